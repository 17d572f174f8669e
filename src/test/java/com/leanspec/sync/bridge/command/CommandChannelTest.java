package com.leanspec.sync.bridge.command;

import static com.leanspec.sync.testing.SpecFixtures.project;
import static com.leanspec.sync.testing.SpecFixtures.readme;
import static com.leanspec.sync.testing.SpecFixtures.writeSpec;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.bridge.audit.BridgeAuditLog;
import com.leanspec.sync.bridge.config.BridgeConfigStore;
import com.leanspec.sync.bridge.config.BridgeIdentity;
import com.leanspec.sync.bridge.config.BridgeSettings;
import com.leanspec.sync.bridge.config.ProjectConfig;
import com.leanspec.sync.bridge.outbound.EventSender;
import com.leanspec.sync.bridge.outbound.LocalEventQueue;
import com.leanspec.sync.bridge.spec.SpecRepository;
import com.leanspec.sync.core.channel.BridgeMessage;
import com.leanspec.sync.core.command.CommandStatus;
import com.leanspec.sync.core.json.JacksonConfig;
import com.leanspec.sync.testing.MutableClock;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

class CommandChannelTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @TempDir
    Path dir;

    private final ObjectMapper mapper = JacksonConfig.newObjectMapper();

    private ProjectConfig project;
    private EventSender sender;
    private CommandChannel channel;

    @BeforeEach
    void setUp() throws Exception {
        project = project(Files.createDirectories(dir.resolve("app")), "p1");
        BridgeConfigStore store = new BridgeConfigStore(dir.resolve("cfg"), mapper);
        BridgeIdentity identity = new BridgeIdentity(store, store.load());
        BridgeAuditLog audit = new BridgeAuditLog(dir.resolve("cfg/bridge-audit.log"), new MutableClock(NOW));
        CommandExecutor executor = new CommandExecutor(Map.of("p1", new SpecRepository(project)), identity, audit,
                new MutableClock(NOW));
        sender = new EventSender(event -> Mono.empty(), new LocalEventQueue(dir.resolve("cfg/queue.json"), mapper));
        BridgeSettings settings = new BridgeSettings("http://localhost:3333", "m1", List.of(project),
                dir.resolve("cfg"), "test");
        channel = new CommandChannel(settings, identity, executor, sender, mock(WebSocketClient.class), mapper,
                Duration.ofSeconds(10), Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        sender.close();
    }

    @Test
    void unknownCommandTypeIsAnsweredWithAnError() throws Exception {
        List<BridgeMessage> sent = deliver(
                "{\"id\":\"c1\",\"command\":{\"type\":\"future_op\"},\"createdAt\":\"2025-03-01T10:00:00Z\"}");

        assertThat(sent).singleElement().isInstanceOfSatisfying(BridgeMessage.CommandResult.class, result -> {
            assertThat(result.commandId()).isEqualTo("c1");
            assertThat(result.status()).isEqualTo(CommandStatus.ERROR);
            assertThat(result.message()).contains("future_op");
        });
    }

    @Test
    void metadataEditNamingAPathOutsideTheSpecsDirectoryIsAnsweredWithAnError() throws Exception {
        Path victim = Files.createDirectories(dir.resolve("victim")).resolve("README.md");
        String original = readme("planned", "Victim");
        Files.writeString(victim, original);

        List<BridgeMessage> sent = deliver("{\"id\":\"c2\",\"command\":{\"type\":\"apply_metadata\","
                + "\"projectId\":\"p1\",\"specName\":\"../../victim\",\"status\":\"complete\"},"
                + "\"createdAt\":\"2025-03-01T10:00:00Z\"}");

        assertThat(sent).singleElement().isInstanceOfSatisfying(BridgeMessage.CommandResult.class, result -> {
            assertThat(result.commandId()).isEqualTo("c2");
            assertThat(result.status()).isEqualTo(CommandStatus.ERROR);
            assertThat(result.message()).contains("single directory name");
        });
        assertThat(Files.readString(victim)).isEqualTo(original);
    }

    @Test
    void frameWithoutAnIdGetsNoAnswer() throws Exception {
        assertThat(deliver("{\"command\":{\"type\":\"future_op\"}}")).isEmpty();
        assertThat(deliver("not json")).isEmpty();
    }

    @Test
    void redeliveredCommandIsAnsweredWithTheStoredResult() throws Exception {
        writeSpec(project, "001-foo", readme("planned", "Foo"));
        String frame = "{\"id\":\"c3\",\"command\":{\"type\":\"apply_metadata\",\"projectId\":\"p1\","
                + "\"specName\":\"001-foo\",\"status\":\"in-progress\"},\"createdAt\":\"2025-03-01T10:00:00Z\"}";

        List<BridgeMessage> first = deliver(frame);
        Files.writeString(project.specsDir().resolve("001-foo/README.md"), readme("archived", "Foo"));
        List<BridgeMessage> second = deliver(frame);

        assertThat(second).isEqualTo(first);
        assertThat(first).singleElement().isInstanceOfSatisfying(BridgeMessage.CommandResult.class,
                result -> assertThat(result.status()).isEqualTo(CommandStatus.OK));
        assertThat(Files.readString(project.specsDir().resolve("001-foo/README.md"))).contains("status: archived");
    }

    private List<BridgeMessage> deliver(String frame) throws Exception {
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        channel.onCommand(outbound, frame).block(Duration.ofSeconds(10));
        outbound.tryEmitComplete();
        List<String> frames = outbound.asFlux().collectList().block(Duration.ofSeconds(10));
        return frames.stream()
                .map(this::decode)
                .collect(Collectors.toList());
    }

    private BridgeMessage decode(String json) {
        try {
            return mapper.readValue(json, BridgeMessage.class);
        } catch (Exception e) {
            throw new AssertionError("Undecodable frame " + json, e);
        }
    }
}
