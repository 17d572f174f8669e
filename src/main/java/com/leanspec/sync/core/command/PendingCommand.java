package com.leanspec.sync.core.command;

import java.time.Instant;
import java.util.UUID;

/**
 * =====================================================================
 * PendingCommand
 * =====================================================================
 *
 * PURPOSE
 * -------
 * A queued, at-least-once-delivered instruction for one machine. This is
 * also the exact server→bridge WebSocket frame:
 *
 *   {"id":"...","command":{"type":"rename_machine","label":"..."},"createdAt":"..."}
 *
 * LIFECYCLE
 * ---------
 *   1. Operator action appends it to the machine's queue (persisted).
 *   2. Pushed immediately if the machine has a live channel.
 *   3. Replayed in full on every Hello until acknowledged.
 *   4. Removed only by a CommandResult carrying the same {@link #id}.
 *
 * Transmission alone NEVER removes a command.
 */
public record PendingCommand(String id, SyncCommand command, Instant createdAt) {

    public static PendingCommand create(SyncCommand command, Instant now) {
        return new PendingCommand(UUID.randomUUID().toString(), command, now);
    }
}
