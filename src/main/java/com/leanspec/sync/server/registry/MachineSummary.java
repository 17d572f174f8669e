package com.leanspec.sync.server.registry;

import java.time.Instant;

/**
 * Listing view of a machine. {@code status} is {@code online} or {@code offline}.
 */
public record MachineSummary(
        String id,
        String label,
        String status,
        Instant lastSeen,
        int projectCount,
        boolean revoked,
        int pendingCommandCount) {

    public static final String ONLINE = "online";
    public static final String OFFLINE = "offline";
}
