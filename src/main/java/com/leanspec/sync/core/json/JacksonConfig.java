package com.leanspec.sync.core.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Central Jackson configuration shared by the sync server and the bridge.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Ensure Java time types ({@code Instant}) serialize as ISO-8601 strings on the wire and on disk.</li>
 *   <li>Tolerate unknown properties so that older bridges keep talking to newer servers (and vice versa).</li>
 *   <li>Omit {@code null} fields so optional wire fields ({@code message?}, {@code expiresAt?}) stay absent.</li>
 * </ul>
 *
 * <h2>Usage outside Spring</h2>
 * The bridge runs without an application context and obtains the same mapper through
 * {@link #newObjectMapper()}, so both ends of the wire agree on every setting.
 */
@Configuration
public class JacksonConfig {

    /**
     * Primary {@link ObjectMapper} for the server context; also used by the WebFlux codecs.
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return newObjectMapper();
    }

    public static ObjectMapper newObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // Enables Jackson support for java.time (Instant/Duration, etc.).
        mapper.registerModule(new JavaTimeModule());

        // Prefer ISO-8601 textual representation instead of numeric timestamps.
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // revoke_machine carries only its type id.
        mapper.disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        return mapper;
    }
}
