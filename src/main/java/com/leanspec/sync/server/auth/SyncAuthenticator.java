package com.leanspec.sync.server.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import com.leanspec.sync.core.error.SyncException;
import com.leanspec.sync.core.model.AccessToken;
import com.leanspec.sync.server.config.SyncServerProperties;
import com.leanspec.sync.server.registry.MachineRegistry;

/**
 * Accepts either the configured shared key in {@code x-api-key} or a bearer token from the
 * registry's token table that has not expired.
 */
@Component
public class SyncAuthenticator {

    public static final String API_KEY_HEADER = "x-api-key";
    private static final String BEARER_PREFIX = "Bearer ";

    private final MachineRegistry registry;
    private final SyncServerProperties props;
    private final Clock clock;

    public SyncAuthenticator(MachineRegistry registry, SyncServerProperties props, Clock clock) {
        this.registry = registry;
        this.props = props;
        this.clock = clock;
    }

    /**
     * @throws SyncException AUTH when no acceptable credential is present
     */
    public void authenticate(HttpHeaders headers) {
        String apiKey = headers.getFirst(API_KEY_HEADER);
        boolean apiKeyPresented = apiKey != null && !apiKey.isBlank();
        if (apiKeyPresented) {
            String expected = props.getApiKey();
            if (expected != null && !expected.isBlank() && constantTimeEquals(expected, apiKey.trim())) {
                return;
            }
        }

        // A rejected API key still falls through to the bearer token.
        String authorization = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            boolean valid = !token.isEmpty() && registry.findToken(token)
                    .map(t -> t.isValidAt(clock.instant()))
                    .orElse(false);
            if (valid) {
                return;
            }
            throw SyncException.unauthorized("Invalid or expired access token");
        }

        throw SyncException.unauthorized(apiKeyPresented ? "Invalid API key" : "Missing x-api-key or bearer token");
    }

    private static boolean constantTimeEquals(String a, String b) {
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
