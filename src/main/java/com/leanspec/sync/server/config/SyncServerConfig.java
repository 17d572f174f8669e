package com.leanspec.sync.server.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.server.registry.RegistryStateStore;

/**
 * Wires the sync server's infrastructure beans.
 */
@Configuration
@EnableConfigurationProperties(SyncServerProperties.class)
public class SyncServerConfig {

    /** Time source for last-seen, TTL checks and audit timestamps; tests swap in a fixed clock. */
    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryStateStore registryStateStore(SyncServerProperties props, ObjectMapper mapper) {
        return new RegistryStateStore(props.getStateFile(), mapper);
    }
}
