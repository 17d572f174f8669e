package com.leanspec.sync.bridge.spec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.leanspec.sync.bridge.config.ProjectConfig;
import com.leanspec.sync.core.command.SyncCommand;
import com.leanspec.sync.core.hash.ContentHash;
import com.leanspec.sync.core.model.SpecRecord;

/**
 * Reads and edits the specs of one project: {@code <specsDir>/<specName>/README.md}.
 */
public class SpecRepository {

    private static final Logger log = LoggerFactory.getLogger(SpecRepository.class);

    public static final String README = "README.md";

    public static final Set<String> STATUSES = Set.of("planned", "in-progress", "complete", "archived");
    public static final Set<String> PRIORITIES = Set.of("low", "medium", "high", "critical");

    static final String STATUS_COMPLETE = "complete";

    private final ProjectConfig project;

    public SpecRepository(ProjectConfig project) {
        this.project = project;
    }

    public ProjectConfig project() {
        return project;
    }

    /** Every spec directory with a README, ordered by name. Unparsable specs are skipped and logged. */
    public List<SpecRecord> loadAll() {
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(project.specsDir(), Files::isDirectory)) {
            stream.forEach(dirs::add);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + project.specsDir(), e);
        }
        dirs.sort(Comparator.comparing(p -> p.getFileName().toString()));

        List<SpecRecord> out = new ArrayList<>();
        for (Path dir : dirs) {
            String name = dir.getFileName().toString();
            try {
                load(name).ifPresent(out::add);
            } catch (RuntimeException e) {
                log.warn("Skipping spec {} in {}: {}", name, project.name(), e.getMessage());
            }
        }
        return out;
    }

    public Optional<SpecRecord> load(String specName) {
        Path file = readmeOf(specName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        return Optional.of(toRecord(specName, file, content));
    }

    /**
     * Applies the metadata edit to the spec file and returns the reloaded record.
     *
     * @throws SpecNotFoundException when the spec does not exist
     * @throws IllegalArgumentException for an unknown status or priority
     */
    public SpecRecord applyMetadata(SyncCommand.ApplyMetadata edit, Instant now) {
        Path file = readmeOf(edit.specName());
        if (!Files.isRegularFile(file)) {
            throw new SpecNotFoundException(edit.specName());
        }
        if (edit.status() != null && !STATUSES.contains(edit.status())) {
            throw new IllegalArgumentException("Invalid status: " + edit.status());
        }
        if (edit.priority() != null && !PRIORITIES.contains(edit.priority())) {
            throw new IllegalArgumentException("Invalid priority: " + edit.priority());
        }

        String content = read(file);
        SpecFileFormat.Document doc = SpecFileFormat.parse(content);
        Map<String, Object> fm = doc.frontmatter();

        if (edit.status() != null) {
            Object previous = fm.get("status");
            fm.put("status", edit.status());
            if (STATUS_COMPLETE.equals(edit.status()) && !STATUS_COMPLETE.equals(previous)) {
                fm.put("completed_at", now.toString());
            }
        }
        if (edit.priority() != null) {
            fm.put("priority", edit.priority());
        }
        if (edit.tags() != null) {
            fm.put("tags", new ArrayList<>(edit.tags()));
        }
        if (edit.addDependsOn() != null || edit.removeDependsOn() != null) {
            List<String> deps = new ArrayList<>(stringList(fm.get("depends_on")));
            if (edit.addDependsOn() != null) {
                for (String dep : edit.addDependsOn()) {
                    if (!deps.contains(dep)) {
                        deps.add(dep);
                    }
                }
            }
            if (edit.removeDependsOn() != null) {
                deps.removeAll(edit.removeDependsOn());
            }
            fm.put("depends_on", deps);
        }
        if (edit.parent() != null) {
            if (edit.parent().isBlank()) {
                fm.remove("parent");
            } else {
                fm.put("parent", edit.parent());
            }
        }
        fm.put("updated_at", now.toString());

        write(file, SpecFileFormat.render(new SpecFileFormat.Document(fm, doc.body())));
        return load(edit.specName()).orElseThrow(() -> new SpecNotFoundException(edit.specName()));
    }

    /**
     * @throws IllegalArgumentException when the name does not denote a directory directly under the
     *         specs directory
     */
    public Path readmeOf(String specName) {
        if (!SyncCommand.ApplyMetadata.isSpecDirectoryName(specName)) {
            throw new IllegalArgumentException("Invalid spec name: " + specName);
        }
        Path specsDir = project.specsDir().toAbsolutePath().normalize();
        Path dir = specsDir.resolve(specName).normalize();
        if (!specsDir.equals(dir.getParent())) {
            throw new IllegalArgumentException("Invalid spec name: " + specName);
        }
        return dir.resolve(README);
    }

    private SpecRecord toRecord(String specName, Path file, String content) {
        SpecFileFormat.Document doc = SpecFileFormat.parse(content);
        Map<String, Object> fm = doc.frontmatter();

        String title = string(fm.get("title"));
        if (title == null) {
            title = SpecFileFormat.title(doc.body());
        }
        Instant createdAt = instant(fm.get("created_at"));
        if (createdAt == null) {
            createdAt = instant(fm.get("created"));
        }

        return new SpecRecord(
                specName,
                title == null ? specName : title,
                Optional.ofNullable(string(fm.get("status"))).orElse("planned"),
                string(fm.get("priority")),
                stringList(fm.get("tags")),
                string(fm.get("assignee")),
                content,
                ContentHash.of(content),
                createdAt,
                instant(fm.get("updated_at")),
                instant(fm.get("completed_at")),
                stringList(fm.get("depends_on")),
                string(fm.get("parent")),
                project.root().relativize(file).toString().replace('\\', '/'));
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    private static void write(Path file, String content) {
        Path tmp = file.resolveSibling(README + ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + file, e);
        }
    }

    private static String string(Object value) {
        if (value == null) {
            return null;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? null : s;
    }

    private static List<String> stringList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            List<String> out = new ArrayList<>();
            for (Object item : items) {
                if (item != null) {
                    out.add(item.toString());
                }
            }
            return out;
        }
        return List.of(value.toString());
    }

    static Instant instant(Object value) {
        String s = string(value);
        if (s == null) {
            return null;
        }
        try {
            if (s.indexOf('T') < 0) {
                return LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return OffsetDateTime.parse(s).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable timestamp '{}'", s);
            return null;
        }
    }
}
