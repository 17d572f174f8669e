package com.leanspec.sync.bridge.command;

import com.leanspec.sync.bridge.outbound.QueuedEvent;
import com.leanspec.sync.core.command.CommandStatus;

/**
 * Result of executing one command locally. {@code followUp} is an event to send once the result
 * has been reported (the updated spec after a metadata edit).
 */
public record CommandOutcome(CommandStatus status, String message, String currentContentHash, QueuedEvent followUp) {

    public static CommandOutcome ok(QueuedEvent followUp) {
        return new CommandOutcome(CommandStatus.OK, null, null, followUp);
    }

    public static CommandOutcome conflict(String currentContentHash) {
        return new CommandOutcome(CommandStatus.CONFLICT, "content hash mismatch", currentContentHash, null);
    }

    public static CommandOutcome error(String message) {
        return new CommandOutcome(CommandStatus.ERROR, message, null, null);
    }
}
