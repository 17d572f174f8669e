package com.leanspec.sync.core.hash;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content digest used as the optimistic-concurrency token of a spec.
 *
 * <p>Lower-case hex SHA-256 of the UTF-8 bytes. A {@code null} content hashes like the empty string.</p>
 */
public final class ContentHash {

    private ContentHash() {
    }

    public static String of(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
