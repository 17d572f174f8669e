package com.leanspec.sync.server.ws;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Live channels by machine id. At most one per machine: a newer Hello replaces (and closes) the
 * older session.
 */
@Component
public class BridgeSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(BridgeSessionRegistry.class);

    private final ConcurrentMap<String, BridgeSession> sessions = new ConcurrentHashMap<>();

    public void register(BridgeSession session) {
        BridgeSession previous = sessions.put(session.machineId(), session);
        if (previous != null && !previous.socketId().equals(session.socketId())) {
            log.info("Replacing channel of machine={} old={} new={}",
                    session.machineId(), previous.socketId(), session.socketId());
            previous.close();
        } else {
            log.info("Channel connected machine={} socket={}", session.machineId(), session.socketId());
        }
    }

    /** Removes the mapping only if it still points at {@code session}. */
    public void unregister(BridgeSession session) {
        if (sessions.remove(session.machineId(), session)) {
            log.info("Channel closed machine={} socket={}", session.machineId(), session.socketId());
        }
    }

    public Optional<BridgeSession> find(String machineId) {
        return Optional.ofNullable(sessions.get(machineId));
    }

    public boolean isConnected(String machineId) {
        return sessions.containsKey(machineId);
    }

    public Set<String> connectedMachineIds() {
        return Set.copyOf(sessions.keySet());
    }
}
