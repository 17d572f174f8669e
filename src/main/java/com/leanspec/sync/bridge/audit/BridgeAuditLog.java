package com.leanspec.sync.bridge.audit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only {@code bridge-audit.log}: one {@code [timestamp] text} line per processed command.
 */
public class BridgeAuditLog {

    private static final Logger log = LoggerFactory.getLogger(BridgeAuditLog.class);

    private final Path file;
    private final Clock clock;

    public BridgeAuditLog(Path file, Clock clock) {
        this.file = file;
        this.clock = clock;
    }

    public synchronized void append(String entry) {
        String line = "[" + clock.instant() + "] " + entry + System.lineSeparator();
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            Files.writeString(file, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            // The command outcome is still reported to the server.
            log.warn("Failed to append to {}: {} (entry: {})", file, e.getMessage(), entry);
        }
    }

    public Path file() {
        return file;
    }
}
