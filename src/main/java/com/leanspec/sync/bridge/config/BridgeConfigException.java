package com.leanspec.sync.bridge.config;

/**
 * Fatal bridge misconfiguration: missing project path, no specs directory, insecure server URL,
 * unreadable config file, or a device authorization that could not complete.
 */
public class BridgeConfigException extends RuntimeException {

    public BridgeConfigException(String message) {
        super(message);
    }

    public BridgeConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
