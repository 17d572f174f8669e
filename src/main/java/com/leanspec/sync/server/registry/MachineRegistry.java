package com.leanspec.sync.server.registry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.leanspec.sync.core.command.PendingCommand;
import com.leanspec.sync.core.command.SyncCommand;
import com.leanspec.sync.core.error.SyncException;
import com.leanspec.sync.core.event.SyncEvent;
import com.leanspec.sync.core.event.SyncEventsRequest;
import com.leanspec.sync.core.model.AccessToken;
import com.leanspec.sync.core.model.ProjectRecord;
import com.leanspec.sync.core.model.SpecRecord;
import com.leanspec.sync.server.config.SyncServerProperties;

/**
 * Authoritative server-side state: machines, their projects and specs, their pending-command
 * queues, and the access-token table.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Every public operation runs under one exclusive lock on the whole registry.</li>
 *   <li>Mutation rates are human-edit rates, so a single lock is sufficient; shard by machine id
 *       if that ever changes.</li>
 *   <li>Operations block (file IO). Reactive callers must run them on
 *       {@code Schedulers.boundedElastic()}.</li>
 * </ul>
 *
 * <h2>Persistence</h2>
 * Every mutating operation writes the full state through {@link RegistryStateStore} before
 * returning. Read operations return copies, never live records.
 */
@Component
public class MachineRegistry {

    private static final Logger log = LoggerFactory.getLogger(MachineRegistry.class);

    private static final String UNKNOWN_LABEL = "Unknown";

    private final ReentrantLock lock = new ReentrantLock();
    private final RegistryStateStore store;
    private final Clock clock;
    private final Duration onlineWindow;
    private final RegistryState state;

    public MachineRegistry(RegistryStateStore store, Clock clock, SyncServerProperties props) {
        this.store = store;
        this.clock = clock;
        this.onlineWindow = props.getOnlineWindow();
        this.state = store.load();
    }

    // ---------------------------------------------------------------------
    // Machines
    // ---------------------------------------------------------------------

    /**
     * Get-or-create. A non-blank label replaces the stored one; {@code lastSeen} is refreshed.
     * A revoked machine is returned unchanged.
     */
    public MachineSummary ensureMachine(String machineId, String label) {
        requireId(machineId, "machineId");
        return write(() -> {
            MachineRecord existing = state.getMachines().get(machineId);
            if (existing != null && existing.isRevoked()) {
                return summarize(existing, id -> false);
            }
            MachineRecord machine = ensure(machineId, label);
            machine.setLastSeen(now());
            return summarize(machine, id -> false);
        });
    }

    /** Heartbeat: refresh {@code lastSeen} of a known, non-revoked machine. Other ids are ignored. */
    public void touch(String machineId) {
        write(() -> {
            MachineRecord machine = state.getMachines().get(machineId);
            if (machine != null && !machine.isRevoked()) {
                machine.setLastSeen(now());
            }
            return null;
        });
    }

    public boolean isRevoked(String machineId) {
        return read(() -> {
            MachineRecord machine = state.getMachines().get(machineId);
            return machine != null && machine.isRevoked();
        });
    }

    public List<MachineSummary> listMachines(Predicate<String> connected) {
        return read(() -> {
            List<MachineSummary> out = new ArrayList<>();
            for (MachineRecord machine : state.getMachines().values()) {
                out.add(summarize(machine, connected));
            }
            return out;
        });
    }

    public MachineSummary summary(String machineId, Predicate<String> connected) {
        return read(() -> summarize(require(machineId), connected));
    }

    /** Projects with their spec records. Still available after revocation. */
    public List<ProjectRecord> projects(String machineId) {
        return read(() -> {
            List<ProjectRecord> out = new ArrayList<>();
            for (ProjectRecord project : require(machineId).getProjects().values()) {
                out.add(project.copy());
            }
            return out;
        });
    }

    public Optional<SpecRecord> findSpec(String machineId, String projectId, String specName) {
        return read(() -> {
            MachineRecord machine = state.getMachines().get(machineId);
            if (machine == null) {
                return Optional.<SpecRecord>empty();
            }
            ProjectRecord project = machine.getProjects().get(projectId);
            return project == null
                    ? Optional.<SpecRecord>empty()
                    : Optional.ofNullable(project.getSpecs().get(specName));
        });
    }

    // ---------------------------------------------------------------------
    // Ingest
    // ---------------------------------------------------------------------

    /**
     * Applies one batch of events in array order.
     *
     * <p>The batch is validated as a whole before anything is touched, so a rejected batch leaves no
     * partial state and can be retried verbatim. Unknown machines are registered on first contact;
     * revoked machines are rejected.</p>
     *
     * @throws SyncException VALIDATION for a malformed batch, AUTH for a revoked machine
     */
    public void ingestEvents(SyncEventsRequest request) {
        validate(request);
        write(() -> {
            MachineRecord existing = state.getMachines().get(request.machineId());
            if (existing != null && existing.isRevoked()) {
                throw SyncException.revoked(request.machineId());
            }

            Instant now = now();
            MachineRecord machine = ensure(request.machineId(), request.machineLabel());
            machine.setLastSeen(now);

            ProjectRecord project = machine.getProjects().computeIfAbsent(request.projectId(), id -> {
                ProjectRecord created = new ProjectRecord(id, isBlank(request.projectName()) ? id : request.projectName());
                created.setLastUpdated(now);
                return created;
            });
            if (!isBlank(request.projectName())) {
                project.setName(request.projectName());
            }
            if (!isBlank(request.projectPath())) {
                project.setPath(request.projectPath());
            }

            for (SyncEvent event : request.events()) {
                if (event instanceof SyncEvent.Snapshot snapshot) {
                    project.replaceAll(snapshot.specs(), now);
                } else if (event instanceof SyncEvent.SpecChanged changed) {
                    project.upsert(changed.spec(), now);
                } else if (event instanceof SyncEvent.SpecDeleted deleted) {
                    project.remove(deleted.specName(), now);
                } else if (event instanceof SyncEvent.Heartbeat) {
                    machine.setLastSeen(now);
                }
            }

            log.debug("Ingested {} event(s) machine={} project={}",
                    request.events().size(), request.machineId(), request.projectId());
            return null;
        });
    }

    // ---------------------------------------------------------------------
    // Command queue
    // ---------------------------------------------------------------------

    /** Appends a command to the machine's queue and persists it. */
    public PendingCommand enqueueCommand(String machineId, SyncCommand command) {
        return write(() -> {
            PendingCommand pending = PendingCommand.create(command, now());
            require(machineId).getPendingCommands().add(pending);
            return pending;
        });
    }

    /** Server-side rename plus a queued RenameMachine, persisted as one mutation. */
    public PendingCommand renameMachine(String machineId, String label) {
        SyncCommand.RenameMachine command = new SyncCommand.RenameMachine(label);
        return write(() -> {
            MachineRecord machine = require(machineId);
            machine.setLabel(label.trim());
            PendingCommand pending = PendingCommand.create(command, now());
            machine.getPendingCommands().add(pending);
            return pending;
        });
    }

    /** Marks the machine revoked (one-way) and queues a RevokeMachine. History is kept. */
    public PendingCommand revokeMachine(String machineId) {
        return write(() -> {
            MachineRecord machine = require(machineId);
            machine.setRevoked(true);
            PendingCommand pending = PendingCommand.create(new SyncCommand.RevokeMachine(), now());
            machine.getPendingCommands().add(pending);
            return pending;
        });
    }

    public List<PendingCommand> pendingCommands(String machineId) {
        return read(() -> {
            MachineRecord machine = state.getMachines().get(machineId);
            return machine == null ? List.<PendingCommand>of() : List.copyOf(machine.getPendingCommands());
        });
    }

    /**
     * Removes the command with the given id.
     *
     * @return the removed command, or empty when the id is unknown (already acknowledged); nothing is
     *         persisted in that case
     */
    public Optional<PendingCommand> acknowledge(String machineId, String commandId) {
        lock.lock();
        try {
            MachineRecord machine = state.getMachines().get(machineId);
            if (machine == null || commandId == null) {
                return Optional.empty();
            }
            Iterator<PendingCommand> it = machine.getPendingCommands().iterator();
            while (it.hasNext()) {
                PendingCommand pending = it.next();
                if (pending.id().equals(commandId)) {
                    it.remove();
                    store.save(state);
                    return Optional.of(pending);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------------
    // Token table
    // ---------------------------------------------------------------------

    public void storeToken(AccessToken token) {
        write(() -> state.getTokens().put(token.token(), token));
    }

    public Optional<AccessToken> findToken(String token) {
        return read(() -> Optional.ofNullable(state.getTokens().get(token)));
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private MachineRecord ensure(String machineId, String label) {
        MachineRecord machine = state.getMachines().get(machineId);
        if (machine == null) {
            machine = new MachineRecord(machineId, isBlank(label) ? UNKNOWN_LABEL : label.trim(), now());
            state.getMachines().put(machineId, machine);
            log.info("Registered machine id={} label={}", machineId, machine.getLabel());
        } else if (!isBlank(label) && !label.trim().equals(machine.getLabel())) {
            machine.setLabel(label.trim());
        }
        return machine;
    }

    private MachineRecord require(String machineId) {
        MachineRecord machine = state.getMachines().get(machineId);
        if (machine == null) {
            throw SyncException.notFound("Machine", machineId);
        }
        return machine;
    }

    private MachineSummary summarize(MachineRecord machine, Predicate<String> connected) {
        boolean online = connected.test(machine.getId())
                || (machine.getLastSeen() != null
                && !machine.getLastSeen().plus(onlineWindow).isBefore(now()));
        return new MachineSummary(
                machine.getId(),
                machine.getLabel(),
                online ? MachineSummary.ONLINE : MachineSummary.OFFLINE,
                machine.getLastSeen(),
                machine.getProjects().size(),
                machine.isRevoked(),
                machine.getPendingCommands().size());
    }

    private static void validate(SyncEventsRequest request) {
        if (request == null) {
            throw SyncException.invalid("request body is required");
        }
        requireId(request.machineId(), "machineId");
        requireId(request.projectId(), "projectId");
        if (request.events() == null) {
            throw SyncException.invalid("events is required");
        }
        for (int i = 0; i < request.events().size(); i++) {
            SyncEvent event = request.events().get(i);
            if (event == null) {
                throw SyncException.invalid("events[" + i + "] is null");
            }
            if (event instanceof SyncEvent.Snapshot snapshot) {
                if (snapshot.specs() == null) {
                    throw SyncException.invalid("events[" + i + "].specs is required");
                }
                for (SpecRecord spec : snapshot.specs()) {
                    requireSpec(spec, i);
                }
            } else if (event instanceof SyncEvent.SpecChanged changed) {
                requireSpec(changed.spec(), i);
            } else if (event instanceof SyncEvent.SpecDeleted deleted) {
                if (isBlank(deleted.specName())) {
                    throw SyncException.invalid("events[" + i + "].specName is required");
                }
            }
        }
    }

    private static void requireSpec(SpecRecord spec, int index) {
        if (spec == null || isBlank(spec.specName())) {
            throw SyncException.invalid("events[" + index + "] carries a spec without specName");
        }
    }

    private static void requireId(String value, String field) {
        if (isBlank(value)) {
            throw SyncException.invalid(field + " is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private Instant now() {
        return clock.instant();
    }

    private <T> T read(Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    /** Runs the mutation and persists it; on any failure the in-memory state is rolled back. */
    private <T> T write(Supplier<T> body) {
        lock.lock();
        try {
            RegistryState before = store.copy(state);
            try {
                T result = body.get();
                store.save(state);
                return result;
            } catch (RuntimeException e) {
                state.setMachines(before.getMachines());
                state.setTokens(before.getTokens());
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }
}
