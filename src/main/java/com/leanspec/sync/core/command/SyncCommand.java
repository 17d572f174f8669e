package com.leanspec.sync.core.command;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;
import com.leanspec.sync.core.error.SyncException;

/**
 * =====================================================================
 * SyncCommand
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Closed set of instructions the server queues for a machine. Each
 * variant travels inside a {@link PendingCommand} and is executed by the
 * bridge exactly once per delivery; delivery itself is at-least-once.
 *
 * WIRE FORMAT
 * -----------
 * Tagged with an explicit {@code type} discriminant:
 *
 *   {"type":"apply_metadata","projectId":"...","specName":"...", ...}
 *   {"type":"rename_machine","label":"..."}
 *   {"type":"revoke_machine"}
 *   {"type":"execution_request","requestId":"...","payload":{...}}
 *
 * LOCKED SEMANTICS
 * ----------------
 * The discriminant values are part of the bridge protocol and MUST NOT
 * change. New variants need a bridge release before the server may emit
 * them.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SyncCommand.ApplyMetadata.class, name = SyncCommand.APPLY_METADATA),
        @JsonSubTypes.Type(value = SyncCommand.RenameMachine.class, name = SyncCommand.RENAME_MACHINE),
        @JsonSubTypes.Type(value = SyncCommand.RevokeMachine.class, name = SyncCommand.REVOKE_MACHINE),
        @JsonSubTypes.Type(value = SyncCommand.ExecutionRequest.class, name = SyncCommand.EXECUTION_REQUEST)
})
public interface SyncCommand {

    String APPLY_METADATA = "apply_metadata";
    String RENAME_MACHINE = "rename_machine";
    String REVOKE_MACHINE = "revoke_machine";
    String EXECUTION_REQUEST = "execution_request";

    /** Discriminant value, also used as the audit action. */
    @JsonIgnore
    String action();

    /**
     * Metadata edit for one spec.
     *
     * <p>Every field except {@code projectId}/{@code specName} is optional; absent means "leave as is".
     * {@code parent} set to an empty string clears the parent. When {@code expectedContentHash} is present
     * the bridge applies the edit only if the spec's current hash still matches.</p>
     */
    record ApplyMetadata(
            String projectId,
            String specName,
            String status,
            String priority,
            List<String> tags,
            List<String> addDependsOn,
            List<String> removeDependsOn,
            String parent,
            String expectedContentHash) implements SyncCommand {

        public ApplyMetadata {
            if (projectId == null || projectId.isBlank()) {
                throw SyncException.invalid("apply_metadata requires projectId");
            }
            if (specName == null || specName.isBlank()) {
                throw SyncException.invalid("apply_metadata requires specName");
            }
            if (!isSpecDirectoryName(specName)) {
                throw SyncException.invalid("apply_metadata specName must be a single directory name: " + specName);
            }
        }

        @Override
        public String action() {
            return APPLY_METADATA;
        }

        /** A spec name names one directory directly under the specs directory. */
        public static boolean isSpecDirectoryName(String name) {
            return name != null
                    && !name.isBlank()
                    && name.indexOf('/') < 0
                    && name.indexOf('\\') < 0
                    && !".".equals(name)
                    && !"..".equals(name);
        }
    }

    record RenameMachine(String label) implements SyncCommand {

        public RenameMachine {
            if (label == null || label.isBlank()) {
                throw SyncException.invalid("rename_machine requires a label");
            }
        }

        @Override
        public String action() {
            return RENAME_MACHINE;
        }
    }

    record RevokeMachine() implements SyncCommand {

        @Override
        public String action() {
            return REVOKE_MACHINE;
        }
    }

    /** Opaque payload handed to whatever runs executions on the machine. */
    record ExecutionRequest(String requestId, JsonNode payload) implements SyncCommand {

        @Override
        public String action() {
            return EXECUTION_REQUEST;
        }
    }
}
