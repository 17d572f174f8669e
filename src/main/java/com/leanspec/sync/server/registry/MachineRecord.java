package com.leanspec.sync.server.registry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.leanspec.sync.core.command.PendingCommand;
import com.leanspec.sync.core.model.ProjectRecord;

/**
 * Server-side record of one bridge machine.
 *
 * <ul>
 *   <li>{@code id} is generated once by the bridge and never changes.</li>
 *   <li>{@code revoked} only ever goes from false to true.</li>
 *   <li>{@code pendingCommands} is ordered oldest first.</li>
 * </ul>
 *
 * Mutable; only touched while holding the {@link MachineRegistry} lock.
 */
public class MachineRecord {

    private String id;
    private String label;
    private boolean revoked;
    private Instant lastSeen;
    private Map<String, ProjectRecord> projects = new LinkedHashMap<>();
    private List<PendingCommand> pendingCommands = new ArrayList<>();

    public MachineRecord() {
    }

    public MachineRecord(String id, String label, Instant lastSeen) {
        this.id = id;
        this.label = label;
        this.lastSeen = lastSeen;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }

    public boolean isRevoked() { return revoked; }
    public void setRevoked(boolean revoked) { this.revoked = revoked; }

    public Instant getLastSeen() { return lastSeen; }
    public void setLastSeen(Instant lastSeen) { this.lastSeen = lastSeen; }

    public Map<String, ProjectRecord> getProjects() { return projects; }
    public void setProjects(Map<String, ProjectRecord> projects) {
        this.projects = projects == null ? new LinkedHashMap<>() : projects;
    }

    public List<PendingCommand> getPendingCommands() { return pendingCommands; }
    public void setPendingCommands(List<PendingCommand> pendingCommands) {
        this.pendingCommands = pendingCommands == null ? new ArrayList<>() : pendingCommands;
    }
}
