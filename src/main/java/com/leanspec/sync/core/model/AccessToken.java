package com.leanspec.sync.core.model;

import java.time.Instant;

/**
 * Opaque bearer credential. Valid while present in the server's token table and not expired.
 */
public record AccessToken(String token, Instant issuedAt, Instant expiresAt) {

    public boolean isValidAt(Instant now) {
        return expiresAt == null || expiresAt.isAfter(now);
    }
}
