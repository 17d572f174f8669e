package com.leanspec.sync.bridge.config;

import java.util.Optional;

import com.leanspec.sync.bridge.auth.AuthCredential;

/**
 * Mutable part of the bridge identity: the label and the credential. Every change is written to
 * {@code bridge.json} before the method returns.
 */
public class BridgeIdentity {

    private final BridgeConfigStore store;
    private final BridgeConfig config;

    public BridgeIdentity(BridgeConfigStore store, BridgeConfig config) {
        this.store = store;
        this.config = config;
    }

    public synchronized String machineId() {
        return config.getMachineId();
    }

    public synchronized String label() {
        return config.getMachineLabel();
    }

    public synchronized void rename(String label) {
        config.setMachineLabel(label);
        store.save(config);
    }

    /** API key wins over a stored access token. */
    public synchronized Optional<AuthCredential> credential() {
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            return Optional.of(AuthCredential.apiKey(config.getApiKey()));
        }
        if (config.getAccessToken() != null && !config.getAccessToken().isBlank()) {
            return Optional.of(AuthCredential.bearer(config.getAccessToken()));
        }
        return Optional.empty();
    }

    public synchronized void storeAccessToken(String token) {
        config.setAccessToken(token);
        store.save(config);
    }

    public synchronized void dropAccessToken() {
        config.setAccessToken(null);
        store.save(config);
    }
}
