package com.leanspec.sync.bridge.watch;

import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.leanspec.sync.bridge.spec.SpecRepository;
import com.leanspec.sync.core.event.SyncEvent;
import com.leanspec.sync.core.model.SpecRecord;

/**
 * Watches one project's specs directory recursively and turns file changes into spec events.
 *
 * <ul>
 *   <li>A changed path maps to the spec named by its first segment under the specs directory.</li>
 *   <li>If that spec still has a README the event is {@code spec_changed}, otherwise a known spec
 *       becomes {@code spec_deleted}.</li>
 *   <li>On watch-queue overflow a full {@code snapshot} is emitted instead.</li>
 * </ul>
 *
 * Runs on its own platform thread; the sink must be thread-safe.
 */
public class SpecDirectoryWatcher implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SpecDirectoryWatcher.class);

    private final SpecRepository repository;
    private final Path specsDir;
    private final Consumer<SyncEvent> sink;
    private final Map<WatchKey, Path> keys = new ConcurrentHashMap<>();
    private final Set<String> known = new HashSet<>();

    private WatchService watchService;
    private Thread thread;

    public SpecDirectoryWatcher(SpecRepository repository, Consumer<SyncEvent> sink) {
        this.repository = repository;
        this.specsDir = repository.project().specsDir();
        this.sink = sink;
    }

    public synchronized void start() {
        if (thread != null) {
            return;
        }
        try {
            watchService = FileSystems.getDefault().newWatchService();
            registerTree(watchService, specsDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to watch " + specsDir, e);
        }
        for (SpecRecord record : repository.loadAll()) {
            known.add(record.specName());
        }
        WatchService service = watchService;
        thread = new Thread(() -> run(service), "spec-watcher-" + repository.project().name());
        thread.setDaemon(true);
        thread.start();
        log.info("Watching {} ({} spec(s))", specsDir, known.size());
    }

    /** First path segment under {@code specsDir}, ignoring hidden entries. */
    public static Optional<String> specNameOf(Path specsDir, Path changed) {
        Path base = specsDir.toAbsolutePath().normalize();
        Path path = changed.toAbsolutePath().normalize();
        if (!path.startsWith(base) || path.equals(base)) {
            return Optional.empty();
        }
        String first = base.relativize(path).getName(0).toString();
        if (first.isEmpty() || first.startsWith(".")) {
            return Optional.empty();
        }
        return Optional.of(first);
    }

    /** Emits one event per affected spec name. */
    void handle(Collection<String> specNames) {
        for (String name : specNames) {
            Optional<SpecRecord> record;
            try {
                record = repository.load(name);
            } catch (RuntimeException e) {
                log.warn("Failed to load spec {}: {}", name, e.getMessage());
                continue;
            }
            if (record.isPresent()) {
                known.add(name);
                sink.accept(new SyncEvent.SpecChanged(record.get()));
            } else if (known.remove(name)) {
                sink.accept(new SyncEvent.SpecDeleted(name));
            }
        }
    }

    void resync() {
        known.clear();
        List<SpecRecord> records = repository.loadAll();
        records.forEach(r -> known.add(r.specName()));
        sink.accept(new SyncEvent.Snapshot(records));
    }

    private void run(WatchService service) {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = service.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (ClosedWatchServiceException e) {
                return;
            }

            Path dir = keys.get(key);
            Set<String> touched = new LinkedHashSet<>();
            boolean overflow = false;
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    overflow = true;
                    continue;
                }
                if (dir == null) {
                    continue;
                }
                Path changed = dir.resolve((Path) event.context());
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(changed)) {
                    try {
                        registerTree(service, changed);
                    } catch (IOException e) {
                        log.warn("Failed to watch new directory {}: {}", changed, e.getMessage());
                    }
                }
                specNameOf(specsDir, changed).ifPresent(touched::add);
            }
            if (!key.reset()) {
                keys.remove(key);
            }

            try {
                if (overflow) {
                    resync();
                } else {
                    handle(touched);
                }
            } catch (RuntimeException e) {
                log.warn("Watcher for {} failed to process changes: {}", specsDir, e.toString(), e);
            }
        }
    }

    private void registerTree(WatchService service, Path root) throws IOException {
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                WatchKey key = dir.register(service,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                keys.put(key, dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public synchronized void close() {
        if (thread != null) {
            thread.interrupt();
            thread = null;
        }
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.debug("Closing watch service for {} failed: {}", specsDir, e.toString());
            }
            watchService = null;
        }
    }
}
