package com.leanspec.sync.server.registry;

import java.util.LinkedHashMap;
import java.util.Map;

import com.leanspec.sync.core.model.AccessToken;

/**
 * Everything the server persists: machines (with their projects, specs and queues) and the token table.
 */
public class RegistryState {

    private Map<String, MachineRecord> machines = new LinkedHashMap<>();
    private Map<String, AccessToken> tokens = new LinkedHashMap<>();

    public Map<String, MachineRecord> getMachines() { return machines; }
    public void setMachines(Map<String, MachineRecord> machines) {
        this.machines = machines == null ? new LinkedHashMap<>() : machines;
    }

    public Map<String, AccessToken> getTokens() { return tokens; }
    public void setTokens(Map<String, AccessToken> tokens) {
        this.tokens = tokens == null ? new LinkedHashMap<>() : tokens;
    }
}
