package com.leanspec.sync.bridge.command;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.leanspec.sync.bridge.audit.BridgeAuditLog;
import com.leanspec.sync.bridge.config.BridgeIdentity;
import com.leanspec.sync.bridge.config.ProjectConfig;
import com.leanspec.sync.bridge.outbound.QueuedEvent;
import com.leanspec.sync.bridge.spec.SpecNotFoundException;
import com.leanspec.sync.bridge.spec.SpecRepository;
import com.leanspec.sync.core.command.PendingCommand;
import com.leanspec.sync.core.command.SyncCommand;
import com.leanspec.sync.core.event.SyncEvent;
import com.leanspec.sync.core.hash.ContentHash;
import com.leanspec.sync.core.model.SpecRecord;

/**
 * Executes server commands against local state. Every call returns exactly one outcome; failures
 * become {@code error} outcomes so the command is still acknowledged.
 */
public class CommandExecutor {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private final Map<String, SpecRepository> repositories;
    private final BridgeIdentity identity;
    private final BridgeAuditLog audit;
    private final Clock clock;

    public CommandExecutor(Map<String, SpecRepository> repositories, BridgeIdentity identity,
                           BridgeAuditLog audit, Clock clock) {
        this.repositories = Map.copyOf(repositories);
        this.identity = identity;
        this.audit = audit;
        this.clock = clock;
    }

    public CommandOutcome execute(PendingCommand pending) {
        SyncCommand command = pending.command();
        try {
            if (command instanceof SyncCommand.ApplyMetadata apply) {
                return applyMetadata(apply);
            }
            if (command instanceof SyncCommand.RenameMachine rename) {
                identity.rename(rename.label());
                audit.append("rename_machine: " + rename.label());
                return CommandOutcome.ok(null);
            }
            if (command instanceof SyncCommand.RevokeMachine) {
                identity.dropAccessToken();
                audit.append("revoke_machine");
                log.warn("Machine revoked by server; stored access token dropped");
                return CommandOutcome.ok(null);
            }
            if (command instanceof SyncCommand.ExecutionRequest exec) {
                audit.append("execution_request: " + exec.requestId() + " payload=" + exec.payload());
                log.info("Execution request {} acknowledged", exec.requestId());
                return CommandOutcome.ok(null);
            }
            return CommandOutcome.error("Unsupported command " + command.getClass().getSimpleName());
        } catch (RuntimeException e) {
            log.warn("Command {} ({}) failed: {}", pending.id(), command.action(), e.getMessage());
            audit.append(command.action() + " error: " + e.getMessage());
            return CommandOutcome.error(e.getMessage());
        }
    }

    private CommandOutcome applyMetadata(SyncCommand.ApplyMetadata apply) {
        SpecRepository repository = repositories.get(apply.projectId());
        if (repository == null) {
            audit.append("apply_metadata error: project not found " + apply.projectId());
            return CommandOutcome.error("Project not found: " + apply.projectId());
        }
        Optional<SpecRecord> current = repository.load(apply.specName());
        if (current.isEmpty()) {
            audit.append("apply_metadata error: spec not found " + apply.specName());
            return CommandOutcome.error("Spec not found: " + apply.specName());
        }

        String currentHash = ContentHash.of(current.get().contentMd());
        if (apply.expectedContentHash() != null && !apply.expectedContentHash().equals(currentHash)) {
            audit.append("apply_metadata conflict: " + apply.specName());
            return CommandOutcome.conflict(currentHash);
        }

        SpecRecord updated;
        try {
            updated = repository.applyMetadata(apply, clock.instant());
        } catch (SpecNotFoundException | IllegalArgumentException e) {
            audit.append("apply_metadata error: " + apply.specName() + ": " + e.getMessage());
            return CommandOutcome.error(e.getMessage());
        }
        audit.append("apply_metadata ok: " + apply.specName());

        ProjectConfig project = repository.project();
        QueuedEvent followUp = new QueuedEvent(project.id(), project.name(), project.root().toString(),
                new SyncEvent.SpecChanged(updated));
        return CommandOutcome.ok(followUp);
    }
}
