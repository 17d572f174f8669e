package com.leanspec.sync.bridge.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns a {@code --project} path into a {@link ProjectConfig}.
 *
 * Specs directory lookup order: {@code specs}, {@code .lean-spec/specs}, {@code docs/specs},
 * {@code doc/specs}, then {@code specsDir} from {@code .lean-spec/config.json}.
 */
public class ProjectResolver {

    private static final Logger log = LoggerFactory.getLogger(ProjectResolver.class);

    static final List<String> CANDIDATES = List.of("specs", ".lean-spec/specs", "docs/specs", "doc/specs");
    static final String FALLBACK_NAME = "LeanSpec Project";

    private final ObjectMapper mapper;

    public ProjectResolver(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ProjectConfig resolve(String path, String machineId) {
        Path root = Path.of(path).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new BridgeConfigException("Project path not found: " + path);
        }
        Path specsDir = findSpecsDir(root)
                .orElseThrow(() -> new BridgeConfigException("specs directory not found for " + path));

        Path fileName = root.getFileName();
        String name = fileName == null ? FALLBACK_NAME : fileName.toString();
        return new ProjectConfig(projectId(machineId, root), name, root, specsDir);
    }

    /** Name-based UUID of machine id and absolute path, stable across restarts. */
    public static String projectId(String machineId, Path root) {
        byte[] seed = (machineId + ":" + root.toString()).getBytes(StandardCharsets.UTF_8);
        return UUID.nameUUIDFromBytes(seed).toString();
    }

    Optional<Path> findSpecsDir(Path root) {
        for (String candidate : CANDIDATES) {
            Path dir = root.resolve(candidate);
            if (Files.isDirectory(dir)) {
                return Optional.of(dir);
            }
        }
        Path configJson = root.resolve(".lean-spec").resolve("config.json");
        if (Files.isRegularFile(configJson)) {
            try {
                JsonNode specsDir = mapper.readTree(configJson.toFile()).path("specsDir");
                if (specsDir.isTextual()) {
                    Path dir = root.resolve(specsDir.asText()).normalize();
                    if (Files.isDirectory(dir)) {
                        return Optional.of(dir);
                    }
                }
            } catch (IOException e) {
                log.warn("Ignoring unreadable {}: {}", configJson, e.getMessage());
            }
        }
        return Optional.empty();
    }
}
