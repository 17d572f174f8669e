package com.leanspec.sync.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-project spec store: spec name to {@link SpecRecord}.
 *
 * <p>Created the first time an event references an unseen project id and never deleted.
 * Instances are mutable and owned by whoever holds the registry lock; hand out {@link #copy()}
 * to anything outside it.</p>
 */
public class ProjectRecord {

    private String id;
    private String name;
    private String path;
    private Map<String, SpecRecord> specs = new LinkedHashMap<>();
    private Instant lastUpdated;

    public ProjectRecord() {
    }

    public ProjectRecord(String id, String name) {
        this.id = id;
        this.name = name;
    }

    /** Snapshot semantics: the whole map is replaced. */
    public void replaceAll(Collection<SpecRecord> records, Instant now) {
        Map<String, SpecRecord> next = new LinkedHashMap<>();
        for (SpecRecord record : records) {
            next.put(record.specName(), record.normalized());
        }
        this.specs = next;
        this.lastUpdated = now;
    }

    public void upsert(SpecRecord record, Instant now) {
        specs.put(record.specName(), record.normalized());
        this.lastUpdated = now;
    }

    public void remove(String specName, Instant now) {
        specs.remove(specName);
        this.lastUpdated = now;
    }

    public List<SpecRecord> specList() {
        return new ArrayList<>(specs.values());
    }

    public ProjectRecord copy() {
        ProjectRecord copy = new ProjectRecord(id, name);
        copy.setPath(path);
        copy.setSpecs(new LinkedHashMap<>(specs));
        copy.setLastUpdated(lastUpdated);
        return copy;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }

    public Map<String, SpecRecord> getSpecs() { return specs; }
    public void setSpecs(Map<String, SpecRecord> specs) { this.specs = specs == null ? new LinkedHashMap<>() : specs; }

    public Instant getLastUpdated() { return lastUpdated; }
    public void setLastUpdated(Instant lastUpdated) { this.lastUpdated = lastUpdated; }
}
