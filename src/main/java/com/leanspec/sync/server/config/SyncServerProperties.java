package com.leanspec.sync.server.config;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Server-side sync configuration.
 *
 * <h2>Binding</h2>
 * Properties are bound from Spring Boot config using the prefix {@code leanspec.sync}, e.g.:
 * <pre>
 * leanspec:
 *   sync:
 *     state-file: data/sync-state.json
 *     api-key: ${LEANSPEC_SYNC_API_KEY:}
 *     device-code-ttl: 15m
 *     device-code-interval: 5s
 *     token-ttl: 0s
 *     verification-uri: http://localhost:3333/sync/activate
 *     online-window: 30s
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>The API key is a shared secret for headless/CI bridges. Source it from the environment
 *       ({@code LEANSPEC_SYNC_API_KEY}) rather than committed config files.</li>
 *   <li>A zero {@code token-ttl} issues tokens that never expire; revocation then relies on
 *       removing the machine.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "leanspec.sync")
public class SyncServerProperties {

    /**
     * JSON file holding the full registry (machines, projects, specs, pending commands, tokens).
     *
     * <p>Rewritten atomically after every mutation.</p>
     */
    private Path stateFile = Path.of("data", "sync-state.json");

    /**
     * Optional shared API key accepted in the {@code x-api-key} header.
     *
     * <p><b>Security</b>: treat as a secret; never log it.</p>
     */
    private String apiKey;

    /** Lifetime of a device code / user code pair. */
    private Duration deviceCodeTtl = Duration.ofMinutes(15);

    /** Poll interval advertised to bridges waiting on device approval. */
    private Duration deviceCodeInterval = Duration.ofSeconds(5);

    /** Lifetime of issued access tokens; zero means no expiry. */
    private Duration tokenTtl = Duration.ZERO;

    /** Page where an operator enters the user code. */
    private String verificationUri = "http://localhost:3333/sync/activate";

    /**
     * A machine without a live channel still counts as online when it was seen within this window.
     */
    private Duration onlineWindow = Duration.ofSeconds(30);

    public Path getStateFile() { return stateFile; }
    public void setStateFile(Path stateFile) { this.stateFile = stateFile; }

    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }

    public Duration getDeviceCodeTtl() { return deviceCodeTtl; }
    public void setDeviceCodeTtl(Duration deviceCodeTtl) { this.deviceCodeTtl = deviceCodeTtl; }

    public Duration getDeviceCodeInterval() { return deviceCodeInterval; }
    public void setDeviceCodeInterval(Duration deviceCodeInterval) { this.deviceCodeInterval = deviceCodeInterval; }

    public Duration getTokenTtl() { return tokenTtl; }
    public void setTokenTtl(Duration tokenTtl) { this.tokenTtl = tokenTtl; }

    public String getVerificationUri() { return verificationUri; }
    public void setVerificationUri(String verificationUri) { this.verificationUri = verificationUri; }

    public Duration getOnlineWindow() { return onlineWindow; }
    public void setOnlineWindow(Duration onlineWindow) { this.onlineWindow = onlineWindow; }
}
