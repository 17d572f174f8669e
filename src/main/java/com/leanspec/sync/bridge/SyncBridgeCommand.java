package com.leanspec.sync.bridge;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.bridge.auth.DeviceAuthClient;
import com.leanspec.sync.bridge.config.BridgeConfig;
import com.leanspec.sync.bridge.config.BridgeConfigException;
import com.leanspec.sync.bridge.config.BridgeConfigStore;
import com.leanspec.sync.bridge.config.BridgeIdentity;
import com.leanspec.sync.bridge.config.BridgeSettings;
import com.leanspec.sync.bridge.config.ProjectConfig;
import com.leanspec.sync.bridge.config.ProjectResolver;
import com.leanspec.sync.core.json.JacksonConfig;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/**
 * LeanSpec sync bridge entry point.
 *
 * Runs until interrupted. Exit code 2 means misconfiguration (bad project path, insecure URL,
 * failed device authorization).
 */
@Command(
    name = "leanspec-sync-bridge",
    version = SyncBridgeCommand.VERSION,
    description = "Replicate local LeanSpec projects to a sync server and execute its commands",
    mixinStandardHelpOptions = true,
    optionListHeading = "%n@|bold Options:|@%n",
    footerHeading = "%n@|bold Examples:|@%n",
    footer = {
        "",
        "  leanspec-sync-bridge --server-url https://sync.example.com --project ~/work/app",
        "",
        "  Headless with an API key:",
        "    leanspec-sync-bridge --server-url https://sync.example.com \\",
        "      --api-key $LEANSPEC_SYNC_API_KEY --project . --label ci-runner",
        ""
    }
)
public class SyncBridgeCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SyncBridgeCommand.class);

    static final String VERSION = "0.1.0";
    static final int EXIT_MISCONFIGURED = 2;

    @Spec
    private CommandSpec spec;

    @Option(
        names = {"--server-url"},
        description = "Sync server base URL (default: value from bridge.json, else " + BridgeConfig.DEFAULT_SERVER_URL + ")"
    )
    private String serverUrl;

    @Option(
        names = {"--api-key"},
        description = "Shared API key; skips device authorization"
    )
    private String apiKey;

    @Option(
        names = {"--project"},
        description = "Project root to sync (repeatable; default: projects from bridge.json)"
    )
    private List<String> projects = new ArrayList<>();

    @Option(
        names = {"--label"},
        description = "Machine label shown to operators (default: host name)"
    )
    private String label;

    @Option(
        names = {"--allow-insecure"},
        description = "Allow a non-https server URL"
    )
    private boolean allowInsecure;

    @Option(
        names = {"--config-dir"},
        description = "Directory for bridge.json, the offline queue and the audit log (default: ~/.lean-spec)"
    )
    private Path configDir;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new SyncBridgeCommand()).execute(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    @Override
    public Integer call() throws Exception {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        SyncBridge bridge;
        try {
            bridge = bootstrap(out);
        } catch (BridgeConfigException e) {
            err.println("Error: " + e.getMessage());
            log.error("Bridge misconfigured: {}", e.getMessage());
            return EXIT_MISCONFIGURED;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            bridge.close();
            stopped.countDown();
        }, "bridge-shutdown"));

        bridge.start();
        stopped.await();
        return 0;
    }

    SyncBridge bootstrap(PrintWriter out) {
        ObjectMapper mapper = JacksonConfig.newObjectMapper();
        Path dir = configDir != null ? configDir : BridgeConfigStore.defaultDirectory();
        BridgeConfigStore store = new BridgeConfigStore(dir, mapper);
        BridgeConfig config = store.load();

        if (!projects.isEmpty()) {
            List<String> absolute = new ArrayList<>();
            for (String project : projects) {
                absolute.add(Path.of(project).toAbsolutePath().normalize().toString());
            }
            config.setProjects(absolute);
        }
        if (label != null && !label.isBlank()) {
            config.setMachineLabel(label.trim());
        }
        if (apiKey != null && !apiKey.isBlank()) {
            config.setApiKey(apiKey.trim());
        }
        if (serverUrl != null && !serverUrl.isBlank()) {
            config.setServerUrl(serverUrl.trim());
        }

        ProjectResolver resolver = new ProjectResolver(mapper);
        List<ProjectConfig> resolved = new ArrayList<>();
        for (String project : config.getProjects()) {
            resolved.add(resolver.resolve(project, config.getMachineId()));
        }
        if (resolved.isEmpty()) {
            throw new BridgeConfigException("No projects configured. Pass --project <path>.");
        }
        store.save(config);

        BridgeSettings settings = new BridgeSettings(config.getServerUrl(), config.getMachineId(),
                resolved, dir, VERSION);
        settings.requireSecureTransport(allowInsecure);

        BridgeIdentity identity = new BridgeIdentity(store, config);
        WebClient webClient = SyncBridge.webClient(settings, mapper);
        if (identity.credential().isEmpty()) {
            String token = new DeviceAuthClient(webClient, out).authorize(identity.label());
            identity.storeAccessToken(token);
            log.info("Device authorized; access token stored in {}", store.file());
        }

        return new SyncBridge(settings, identity, mapper, webClient, new ReactorNettyWebSocketClient(),
                Clock.systemUTC());
    }
}
