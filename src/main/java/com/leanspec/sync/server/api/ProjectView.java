package com.leanspec.sync.server.api;

import java.time.Instant;
import java.util.List;

import com.leanspec.sync.core.model.ProjectRecord;
import com.leanspec.sync.core.model.SpecRecord;

/**
 * Project listing entry: the project with its specs as an array.
 */
public record ProjectView(String id, String name, String path, Instant lastUpdated, List<SpecRecord> specs) {

    public static ProjectView of(ProjectRecord project) {
        return new ProjectView(project.getId(), project.getName(), project.getPath(),
                project.getLastUpdated(), project.specList());
    }
}
