package com.leanspec.sync.core.channel;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.leanspec.sync.core.command.CommandStatus;

/**
 * Frames the bridge sends over the command channel. Server-to-bridge frames are plain
 * {@link com.leanspec.sync.core.command.PendingCommand} objects.
 *
 * <p>The first frame on every connection MUST be {@link Hello}; the server ignores
 * heartbeats and results that arrive before it.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = BridgeMessage.Hello.class, name = "hello"),
        @JsonSubTypes.Type(value = BridgeMessage.Heartbeat.class, name = "heartbeat"),
        @JsonSubTypes.Type(value = BridgeMessage.CommandResult.class, name = "command_result")
})
public interface BridgeMessage {

    record Hello(String machineId, String machineLabel, String version) implements BridgeMessage {
    }

    record Heartbeat(int queueDepth) implements BridgeMessage {
    }

    /**
     * Acknowledges one pending command. {@code currentContentHash} is set on conflicts so the
     * operator can re-issue the edit against the spec's actual state.
     */
    record CommandResult(
            String commandId,
            CommandStatus status,
            String message,
            String currentContentHash) implements BridgeMessage {
    }
}
