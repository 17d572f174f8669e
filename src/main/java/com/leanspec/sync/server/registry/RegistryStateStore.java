package com.leanspec.sync.server.registry;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * File-backed persistence of the whole {@link RegistryState}.
 *
 * <h2>Write-through contract</h2>
 * <ul>
 *   <li>{@link #save(RegistryState)} writes the full snapshot to a sibling temp file and moves it over
 *       the target, so a crash mid-write never leaves a truncated state file.</li>
 *   <li>Failures surface as {@link UncheckedIOException}; the calling registry operation fails with them.</li>
 * </ul>
 *
 * <h2>Recovery</h2>
 * An unreadable state file is moved aside ({@code *.corrupt-<millis>}) and the server starts empty;
 * bridges re-anchor their projects with a Snapshot on their next start.
 */
public class RegistryStateStore {

    private static final Logger log = LoggerFactory.getLogger(RegistryStateStore.class);

    private final Path file;
    private final ObjectMapper mapper;

    public RegistryStateStore(Path file, ObjectMapper mapper) {
        this.file = file.toAbsolutePath().normalize();
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public RegistryState load() {
        if (!Files.exists(file)) {
            log.info("No registry state at {}; starting empty", file);
            return new RegistryState();
        }
        try {
            RegistryState state = mapper.readValue(file.toFile(), RegistryState.class);
            log.info("Loaded registry state from {} machines={} tokens={}",
                    file, state.getMachines().size(), state.getTokens().size());
            return state;
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.error("Registry state {} is unreadable; moving it to {} and starting empty", file, aside, e);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new UncheckedIOException("Failed to move corrupt registry state aside: " + file, moveError);
            }
            return new RegistryState();
        }
    }

    public void save(RegistryState state) {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.getParent());
            mapper.writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist registry state: " + file, e);
        }
    }

    /** Deep copy through the persisted form, so a restored copy is exactly what a reload would give. */
    public RegistryState copy(RegistryState state) {
        return mapper.convertValue(state, RegistryState.class);
    }

    public Path file() {
        return file;
    }
}
