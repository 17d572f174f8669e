package com.leanspec.sync.core.event;

import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/sync/events}: an ordered batch of events for one project of one machine.
 */
public record SyncEventsRequest(
        @NotBlank String machineId,
        String machineLabel,
        @NotBlank String projectId,
        String projectName,
        String projectPath,
        @NotNull List<SyncEvent> events) {
}
