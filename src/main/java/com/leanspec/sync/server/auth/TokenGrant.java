package com.leanspec.sync.server.auth;

/**
 * Response of {@code POST /api/sync/oauth/token}. {@code expiresIn} is absent for non-expiring tokens.
 */
public record TokenGrant(String accessToken, String tokenType, Long expiresIn) {

    public static final String BEARER = "bearer";
}
