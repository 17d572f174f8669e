package com.leanspec.sync.server.ws;

import java.util.Map;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.HandlerMapping;
import org.springframework.web.reactive.handler.SimpleUrlHandlerMapping;

/**
 * Maps the bridge command channel. The WebSocket handler adapter comes from the WebFlux
 * configuration.
 */
@Configuration
public class BridgeWebSocketConfig {

    public static final String PATH = "/api/sync/bridge/ws";

    @Bean
    public HandlerMapping bridgeWebSocketMapping(BridgeWebSocketHandler handler) {
        return new SimpleUrlHandlerMapping(Map.of(PATH, handler), -1);
    }
}
