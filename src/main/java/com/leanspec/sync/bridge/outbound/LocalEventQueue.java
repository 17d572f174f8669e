package com.leanspec.sync.bridge.outbound;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Not-yet-delivered events, oldest first, mirrored to {@code bridge-queue.json} after every change.
 *
 * Owned by {@link EventSender}; other components only read {@link #size()}.
 */
public class LocalEventQueue {

    private static final Logger log = LoggerFactory.getLogger(LocalEventQueue.class);

    private static final TypeReference<List<QueuedEvent>> LIST_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper mapper;
    private final List<QueuedEvent> items = new ArrayList<>();

    public LocalEventQueue(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
        load();
    }

    public synchronized void append(QueuedEvent event) {
        items.add(event);
        persist();
    }

    public synchronized Optional<QueuedEvent> peek() {
        return items.isEmpty() ? Optional.empty() : Optional.of(items.get(0));
    }

    /** Removes the head if it is still {@code expected}. */
    public synchronized void removeHead(QueuedEvent expected) {
        if (!items.isEmpty() && items.get(0) == expected) {
            items.remove(0);
            persist();
        }
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized boolean isEmpty() {
        return items.isEmpty();
    }

    public synchronized List<QueuedEvent> snapshot() {
        return List.copyOf(items);
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<QueuedEvent> loaded = mapper.readValue(file.toFile(), LIST_TYPE);
            if (loaded != null) {
                items.addAll(loaded);
            }
            log.info("Loaded {} queued event(s) from {}", items.size(), file);
        } catch (IOException e) {
            Path aside = file.resolveSibling(file.getFileName() + ".corrupt-" + System.currentTimeMillis());
            log.error("Queue file {} is unreadable; moving it to {}", file, aside, e);
            try {
                Files.move(file, aside, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException moveError) {
                throw new UncheckedIOException("Failed to move corrupt queue aside: " + file, moveError);
            }
        }
    }

    private void persist() {
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            mapper.writeValue(tmp.toFile(), items);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to persist queue: " + file, e);
        }
    }
}
