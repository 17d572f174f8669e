package com.leanspec.sync.server.command;

import java.time.Clock;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.leanspec.sync.core.channel.BridgeMessage;
import com.leanspec.sync.core.command.CommandStatus;
import com.leanspec.sync.core.command.PendingCommand;
import com.leanspec.sync.core.command.SyncCommand;
import com.leanspec.sync.core.model.AuditLogEntry;
import com.leanspec.sync.server.audit.AuditLogStore;
import com.leanspec.sync.server.registry.MachineRegistry;
import com.leanspec.sync.server.ws.BridgeSessionRegistry;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Issues commands to machines and records their acknowledgements.
 *
 * Durability first: the command is in the persisted queue before any push is attempted, so a
 * failed or missing channel only delays delivery until the machine's next Hello.
 */
@Service
public class CommandService {

    private static final Logger log = LoggerFactory.getLogger(CommandService.class);

    static final String STATUS_DELIVERED = "delivered";
    static final String STATUS_QUEUED = "queued";

    private final MachineRegistry registry;
    private final BridgeSessionRegistry sessions;
    private final AuditLogStore audit;
    private final Clock clock;

    public CommandService(MachineRegistry registry, BridgeSessionRegistry sessions, AuditLogStore audit, Clock clock) {
        this.registry = registry;
        this.sessions = sessions;
        this.audit = audit;
        this.clock = clock;
    }

    public Mono<PendingCommand> issue(String machineId, SyncCommand command) {
        return dispatch(machineId, () -> registry.enqueueCommand(machineId, command));
    }

    public Mono<PendingCommand> rename(String machineId, String label) {
        return dispatch(machineId, () -> registry.renameMachine(machineId, label));
    }

    public Mono<PendingCommand> revoke(String machineId) {
        return dispatch(machineId, () -> registry.revokeMachine(machineId));
    }

    /**
     * Removes the acknowledged command and audits the outcome. Results for unknown or already
     * acknowledged ids complete empty.
     */
    public Mono<PendingCommand> acknowledge(String machineId, BridgeMessage.CommandResult result) {
        return Mono.fromCallable(() -> registry.acknowledge(machineId, result.commandId()))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(removed -> removed.map(Mono::just).orElseGet(() -> {
                    log.debug("Ignoring result for unknown command id={} machine={}", result.commandId(), machineId);
                    return Mono.empty();
                }))
                .flatMap(acked -> {
                    CommandStatus status = result.status() == null ? CommandStatus.ERROR : result.status();
                    log.info("Command acknowledged id={} machine={} action={} status={}",
                            acked.id(), machineId, acked.command().action(), status.wire());
                    return audit.append(entry(machineId, acked.command(), AuditLogEntry.ACTION_COMMAND_RESULT,
                                    status.wire(), resultMessage(acked, result)))
                            .thenReturn(acked);
                });
    }

    private Mono<PendingCommand> dispatch(String machineId, Callable<PendingCommand> enqueue) {
        return Mono.fromCallable(enqueue)
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(pending -> {
                    boolean pushed = sessions.find(machineId)
                            .map(session -> session.send(pending))
                            .orElse(false);
                    log.info("Command issued id={} machine={} action={} {}",
                            pending.id(), machineId, pending.command().action(), pushed ? STATUS_DELIVERED : STATUS_QUEUED);
                    return audit.append(entry(machineId, pending.command(), AuditLogEntry.ACTION_COMMAND_ISSUED,
                                    pushed ? STATUS_DELIVERED : STATUS_QUEUED, pending.command().action()))
                            .thenReturn(pending);
                });
    }

    private AuditLogEntry entry(String machineId, SyncCommand command, String action, String status, String message) {
        String projectId = null;
        String specName = null;
        if (command instanceof SyncCommand.ApplyMetadata apply) {
            projectId = apply.projectId();
            specName = apply.specName();
        }
        return AuditLogEntry.of(machineId, projectId, specName, action, status, message, clock.instant());
    }

    private static String resultMessage(PendingCommand acked, BridgeMessage.CommandResult result) {
        StringBuilder sb = new StringBuilder(acked.command().action());
        if (result.message() != null && !result.message().isBlank()) {
            sb.append(": ").append(result.message());
        }
        if (result.currentContentHash() != null) {
            sb.append(" (currentContentHash=").append(result.currentContentHash()).append(')');
        }
        return sb.toString();
    }
}
