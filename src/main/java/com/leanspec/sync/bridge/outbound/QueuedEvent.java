package com.leanspec.sync.bridge.outbound;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.leanspec.sync.core.event.SyncEvent;

/**
 * One outbound event with the project it belongs to. This is also the element type of
 * {@code bridge-queue.json}.
 */
public record QueuedEvent(String projectId, String projectName, String projectPath, SyncEvent event) {

    /** Heartbeats only matter while fresh; they are never written to the offline queue. */
    @JsonIgnore
    public boolean isPersistable() {
        return !(event instanceof SyncEvent.Heartbeat);
    }
}
