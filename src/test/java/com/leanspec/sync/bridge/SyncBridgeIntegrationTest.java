package com.leanspec.sync.bridge;

import static com.leanspec.sync.testing.SpecFixtures.readme;
import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.bridge.config.BridgeConfig;
import com.leanspec.sync.bridge.config.BridgeConfigStore;
import com.leanspec.sync.bridge.config.BridgeIdentity;
import com.leanspec.sync.bridge.config.BridgeSettings;
import com.leanspec.sync.bridge.config.ProjectConfig;
import com.leanspec.sync.bridge.config.ProjectResolver;
import com.leanspec.sync.bridge.outbound.HttpEventPublisher;
import com.leanspec.sync.bridge.outbound.QueuedEvent;
import com.leanspec.sync.core.error.SyncErrorKind;
import com.leanspec.sync.core.error.SyncException;
import com.leanspec.sync.core.event.SyncEvent;
import com.leanspec.sync.core.hash.ContentHash;
import com.leanspec.sync.core.json.JacksonConfig;
import com.leanspec.sync.core.model.SpecRecord;
import com.leanspec.sync.server.SyncServerApplication;
import com.leanspec.sync.server.auth.SyncAuthenticator;
import com.leanspec.sync.server.registry.MachineRegistry;
import com.leanspec.sync.server.ws.BridgeSessionRegistry;

import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

@SpringBootTest(
        classes = SyncServerApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "leanspec.sync.api-key=bridge-key",
                "leanspec.sync.state-file=target/test-state/${random.uuid}.json"
        })
class SyncBridgeIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(20);

    @LocalServerPort
    int port;

    @Autowired
    WebTestClient client;

    @Autowired
    MachineRegistry registry;

    @Autowired
    BridgeSessionRegistry sessions;

    @TempDir
    Path dir;

    private final ObjectMapper mapper = JacksonConfig.newObjectMapper();
    private Path readmePath;
    private String machineId;
    private ProjectConfig project;
    private BridgeIdentity identity;
    private WebClient webClient;
    private SyncBridge bridge;

    @BeforeEach
    void setUp() throws Exception {
        Path root = Files.createDirectories(dir.resolve("app"));
        readmePath = Files.createDirectories(root.resolve("specs/001-foo")).resolve("README.md");
        Files.writeString(readmePath, readme("planned", "Foo"));

        BridgeConfigStore store = new BridgeConfigStore(dir.resolve("cfg"), mapper);
        BridgeConfig config = store.load();
        config.setApiKey("bridge-key");
        machineId = config.getMachineId();
        project = new ProjectResolver(mapper).resolve(root.toString(), machineId);

        BridgeSettings settings = new BridgeSettings("http://localhost:" + port, machineId,
                List.of(project), store.directory(), "test");
        identity = new BridgeIdentity(store, config);
        webClient = SyncBridge.webClient(settings, mapper);
        bridge = new SyncBridge(settings, identity, mapper, new HttpEventPublisher(webClient, identity),
                new ReactorNettyWebSocketClient(), Clock.systemUTC(),
                Duration.ofMillis(500), Duration.ofMillis(500), Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        bridge.close();
    }

    @Test
    void metadataEditRoundTripsThroughTheBridge() throws Exception {
        bridge.start();

        await().atMost(TIMEOUT).until(() -> registry.findSpec(machineId, project.id(), "001-foo").isPresent());
        await().atMost(TIMEOUT).until(() -> sessions.isConnected(machineId));

        String hash = ContentHash.of(Files.readString(readmePath));
        client.post().uri("/api/sync/machines/{id}/projects/{project}/specs/001-foo/metadata", machineId, project.id())
                .header(SyncAuthenticator.API_KEY_HEADER, "bridge-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("status", "in-progress", "expectedContentHash", hash))
                .exchange()
                .expectStatus().isOk();

        await().atMost(TIMEOUT).untilAsserted(() -> {
            assertThat(registry.pendingCommands(machineId)).isEmpty();
            assertThat(registry.findSpec(machineId, project.id(), "001-foo"))
                    .map(SpecRecord::status)
                    .contains("in-progress");
        });
        assertThat(Files.readString(readmePath)).contains("status: in-progress");
        assertThat(bridge.queueDepth()).isZero();

        client.get().uri("/api/sync/machines/{id}/audit", machineId)
                .header(SyncAuthenticator.API_KEY_HEADER, "bridge-key")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.entries[0].action").isEqualTo("command_result")
                .jsonPath("$.entries[0].status").isEqualTo("ok");
    }

    @Test
    void commandsQueuedWhileOfflineAreReplayedOnConnect() {
        registry.ensureMachine(machineId, "Before");
        client.patch().uri("/api/sync/machines/{id}", machineId)
                .header(SyncAuthenticator.API_KEY_HEADER, "bridge-key")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("label", "Renamed"))
                .exchange()
                .expectStatus().isOk();
        assertThat(registry.pendingCommands(machineId)).hasSize(1);

        bridge.start();

        await().atMost(TIMEOUT).until(() -> registry.pendingCommands(machineId).isEmpty());
        await().atMost(TIMEOUT).untilAsserted(() -> assertThat(
                new BridgeConfigStore(dir.resolve("cfg"), mapper).load().getMachineLabel()).isEqualTo("Renamed"));
    }

    @Test
    void eventTheServerRefusesFailsAsValidationRatherThanTransport() {
        HttpEventPublisher publisher = new HttpEventPublisher(webClient, identity);
        QueuedEvent malformed = new QueuedEvent(project.id(), project.name(), project.root().toString(),
                new SyncEvent.SpecDeleted(" "));

        StepVerifier.create(publisher.publish(malformed))
                .expectErrorSatisfies(err -> assertThat(err)
                        .isInstanceOfSatisfying(SyncException.class,
                                e -> assertThat(e.kind()).isEqualTo(SyncErrorKind.VALIDATION)))
                .verify(TIMEOUT);
    }

    @Test
    void channelHandshakeWithoutCredentialsIsRefused() {
        URI uri = URI.create("ws://localhost:" + port + BridgeSettings.CHANNEL_PATH);

        StepVerifier.create(new ReactorNettyWebSocketClient().execute(uri, session -> Mono.never()))
                .expectError()
                .verify(TIMEOUT);
    }
}
