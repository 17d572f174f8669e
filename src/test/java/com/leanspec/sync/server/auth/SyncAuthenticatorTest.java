package com.leanspec.sync.server.auth;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpHeaders;

import com.leanspec.sync.core.error.SyncException;
import com.leanspec.sync.core.json.JacksonConfig;
import com.leanspec.sync.core.model.AccessToken;
import com.leanspec.sync.server.config.SyncServerProperties;
import com.leanspec.sync.server.registry.MachineRegistry;
import com.leanspec.sync.server.registry.RegistryStateStore;
import com.leanspec.sync.testing.MutableClock;

class SyncAuthenticatorTest {

    @TempDir
    Path dir;

    private MutableClock clock;
    private SyncServerProperties props;
    private MachineRegistry registry;
    private SyncAuthenticator authenticator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        props = new SyncServerProperties();
        props.setApiKey("secret");
        registry = new MachineRegistry(
                new RegistryStateStore(dir.resolve("state.json"), JacksonConfig.newObjectMapper()), clock, props);
        authenticator = new SyncAuthenticator(registry, props, clock);
    }

    @Test
    void acceptsConfiguredApiKey() {
        assertThatCode(() -> authenticator.authenticate(headers(SyncAuthenticator.API_KEY_HEADER, "secret")))
                .doesNotThrowAnyException();
    }

    @Test
    void wrongApiKeyFallsThroughToTheBearerToken() {
        registry.storeToken(new AccessToken("tok", clock.instant(), null));
        HttpHeaders withBearer = headers(SyncAuthenticator.API_KEY_HEADER, "nope");
        withBearer.setBearerAuth("tok");

        assertThatCode(() -> authenticator.authenticate(withBearer)).doesNotThrowAnyException();
        assertThatThrownBy(() -> authenticator.authenticate(headers(SyncAuthenticator.API_KEY_HEADER, "nope")))
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("Invalid API key");
    }

    @Test
    void apiKeyIsRejectedWhenNoneIsConfigured() {
        props.setApiKey(null);

        assertThatThrownBy(() -> authenticator.authenticate(headers(SyncAuthenticator.API_KEY_HEADER, "secret")))
                .isInstanceOf(SyncException.class);
    }

    @Test
    void acceptsStoredBearerUntilItExpires() {
        registry.storeToken(new AccessToken("tok", clock.instant(), clock.instant().plus(Duration.ofMinutes(5))));
        HttpHeaders headers = headers(HttpHeaders.AUTHORIZATION, "Bearer tok");

        assertThatCode(() -> authenticator.authenticate(headers)).doesNotThrowAnyException();

        clock.advance(Duration.ofMinutes(5));
        assertThatThrownBy(() -> authenticator.authenticate(headers))
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("expired");
    }

    @Test
    void rejectsUnknownBearerAndMissingCredentials() {
        assertThatThrownBy(() -> authenticator.authenticate(headers(HttpHeaders.AUTHORIZATION, "Bearer other")))
                .isInstanceOf(SyncException.class);
        assertThatThrownBy(() -> authenticator.authenticate(new HttpHeaders()))
                .isInstanceOf(SyncException.class)
                .hasMessageContaining("Missing");
    }

    private static HttpHeaders headers(String name, String value) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(name, value);
        return headers;
    }
}
