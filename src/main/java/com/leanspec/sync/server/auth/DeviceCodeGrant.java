package com.leanspec.sync.server.auth;

/**
 * Response of {@code POST /api/sync/device/code}. {@code expiresIn} and {@code interval} are seconds.
 */
public record DeviceCodeGrant(
        String deviceCode,
        String userCode,
        String verificationUri,
        long expiresIn,
        long interval) {
}
