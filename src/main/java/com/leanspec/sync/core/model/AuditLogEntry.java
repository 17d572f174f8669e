package com.leanspec.sync.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One append-only audit row: a command issued to, or a result received from, a machine.
 */
public record AuditLogEntry(
        String id,
        String machineId,
        String projectId,
        String specName,
        String action,
        String status,
        String message,
        Instant createdAt) {

    public static final String ACTION_COMMAND_ISSUED = "command_issued";
    public static final String ACTION_COMMAND_RESULT = "command_result";

    public static AuditLogEntry of(String machineId, String projectId, String specName,
                                   String action, String status, String message, Instant now) {
        return new AuditLogEntry(UUID.randomUUID().toString(), machineId, projectId, specName,
                action, status, message, now);
    }
}
