package com.leanspec.sync.core.event;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.leanspec.sync.core.model.SpecRecord;

/**
 * =====================================================================
 * SyncEvent
 * =====================================================================
 *
 * PURPOSE
 * -------
 * One unit of bridge→server state replication for a single project.
 * Events are sent in batches ({@link SyncEventsRequest}) and applied in
 * array order.
 *
 * VARIANTS
 * --------
 *   snapshot      replaces the project's entire spec map (bridge startup)
 *   spec_changed  upserts one record
 *   spec_deleted  removes one record
 *   heartbeat     refreshes the machine's last-seen time only
 *
 * Applying the same event twice yields the same state, which is what
 * makes at-least-once delivery from the bridge queue safe.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SyncEvent.Snapshot.class, name = "snapshot"),
        @JsonSubTypes.Type(value = SyncEvent.SpecChanged.class, name = "spec_changed"),
        @JsonSubTypes.Type(value = SyncEvent.SpecDeleted.class, name = "spec_deleted"),
        @JsonSubTypes.Type(value = SyncEvent.Heartbeat.class, name = "heartbeat")
})
public interface SyncEvent {

    record Snapshot(List<SpecRecord> specs) implements SyncEvent {
    }

    record SpecChanged(SpecRecord spec) implements SyncEvent {
    }

    record SpecDeleted(String specName) implements SyncEvent {
    }

    record Heartbeat(String version, int queueDepth) implements SyncEvent {
    }
}
