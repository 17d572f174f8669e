package com.leanspec.sync.bridge.config;

import java.net.URI;
import java.nio.file.Path;
import java.util.List;

/**
 * Immutable startup view of the bridge: where the server is, who this machine is, and which
 * projects it watches. Fields that commands may change at runtime live in {@link BridgeIdentity}.
 */
public record BridgeSettings(
        String serverUrl,
        String machineId,
        List<ProjectConfig> projects,
        Path configDir,
        String version) {

    public static final String EVENTS_PATH = "/api/sync/events";
    public static final String CHANNEL_PATH = "/api/sync/bridge/ws";

    public BridgeSettings {
        serverUrl = stripTrailingSlash(serverUrl);
        projects = List.copyOf(projects);
    }

    /**
     * @throws BridgeConfigException when the URL is not https and insecure transport was not allowed
     */
    public void requireSecureTransport(boolean allowInsecure) {
        URI uri = URI.create(serverUrl);
        if (!"https".equalsIgnoreCase(uri.getScheme()) && !allowInsecure) {
            throw new BridgeConfigException("TLS required for " + serverUrl + ". Use --allow-insecure for http.");
        }
    }

    public URI channelUri() {
        URI uri = URI.create(serverUrl);
        String scheme = "https".equalsIgnoreCase(uri.getScheme()) ? "wss" : "ws";
        return URI.create(scheme + serverUrl.substring(serverUrl.indexOf("://")) + CHANNEL_PATH);
    }

    public Path queueFile() {
        return configDir.resolve("bridge-queue.json");
    }

    public Path auditFile() {
        return configDir.resolve("bridge-audit.log");
    }

    private static String stripTrailingSlash(String url) {
        String out = url.trim();
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
