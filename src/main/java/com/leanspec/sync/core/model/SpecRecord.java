package com.leanspec.sync.core.model;

import java.time.Instant;
import java.util.List;

import com.leanspec.sync.core.hash.ContentHash;

/**
 * =====================================================================
 * SpecRecord
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Flat, transport-neutral view of one spec as the bridge sees it on disk.
 * The server stores these verbatim per project; it never parses
 * {@link #contentMd()} itself.
 *
 * CONSISTENCY
 * -----------
 * {@link #contentHash()} MUST equal {@code ContentHash.of(contentMd)}.
 * It is the optimistic-concurrency token an operator sends back with an
 * ApplyMetadata command. {@link #normalized()} restores the invariant for
 * records arriving from the wire.
 *
 * IDENTITY
 * --------
 * {@link #specName()} is unique within a project and is the directory
 * name under the project's specs directory (e.g. {@code 001-foo}).
 */
public record SpecRecord(
        String specName,
        String title,
        String status,
        String priority,
        List<String> tags,
        String assignee,
        String contentMd,
        String contentHash,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        List<String> dependsOn,
        String parent,
        String filePath) {

    public SpecRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
    }

    /**
     * Returns this record with {@link #contentHash()} recomputed from {@link #contentMd()}.
     */
    public SpecRecord normalized() {
        String hash = ContentHash.of(contentMd);
        if (hash.equals(contentHash)) {
            return this;
        }
        return new SpecRecord(specName, title, status, priority, tags, assignee, contentMd, hash,
                createdAt, updatedAt, completedAt, dependsOn, parent, filePath);
    }
}
