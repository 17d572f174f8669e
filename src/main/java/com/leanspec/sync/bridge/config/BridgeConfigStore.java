package com.leanspec.sync.bridge.config;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Reads and writes {@code bridge.json} in the bridge config directory ({@code ~/.lean-spec} by default).
 *
 * <p>The machine id is generated on first load and never regenerated; the label defaults to the host name.</p>
 */
public class BridgeConfigStore {

    private static final Logger log = LoggerFactory.getLogger(BridgeConfigStore.class);

    public static final String CONFIG_FILE = "bridge.json";
    static final String FALLBACK_LABEL = "LeanSpec Machine";

    private final Path directory;
    private final ObjectMapper mapper;

    public BridgeConfigStore(Path directory, ObjectMapper mapper) {
        this.directory = directory;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public static Path defaultDirectory() {
        return Path.of(System.getProperty("user.home"), ".lean-spec");
    }

    public BridgeConfig load() {
        Path file = file();
        BridgeConfig config;
        if (Files.exists(file)) {
            try {
                config = mapper.readValue(file.toFile(), BridgeConfig.class);
            } catch (IOException e) {
                throw new BridgeConfigException("Unreadable bridge config " + file + ": " + e.getMessage(), e);
            }
        } else {
            config = new BridgeConfig();
        }

        if (config.getMachineId() == null || config.getMachineId().isBlank()) {
            config.setMachineId(UUID.randomUUID().toString());
            log.info("Generated machine id {}", config.getMachineId());
        }
        if (config.getMachineLabel() == null || config.getMachineLabel().isBlank()) {
            config.setMachineLabel(defaultLabel());
        }
        return config;
    }

    public synchronized void save(BridgeConfig config) {
        Path file = file();
        Path tmp = file.resolveSibling(CONFIG_FILE + ".tmp");
        try {
            Files.createDirectories(directory);
            mapper.writeValue(tmp.toFile(), config);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new BridgeConfigException("Failed to write bridge config " + file + ": " + e.getMessage(), e);
        }
    }

    public Path directory() {
        return directory;
    }

    public Path file() {
        return directory.resolve(CONFIG_FILE);
    }

    static String defaultLabel() {
        try {
            String host = InetAddress.getLocalHost().getHostName();
            return host == null || host.isBlank() ? FALLBACK_LABEL : host;
        } catch (UnknownHostException e) {
            return FALLBACK_LABEL;
        }
    }
}
