package com.leanspec.sync.bridge;

import java.io.Closeable;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.bridge.audit.BridgeAuditLog;
import com.leanspec.sync.bridge.command.CommandChannel;
import com.leanspec.sync.bridge.command.CommandExecutor;
import com.leanspec.sync.bridge.config.BridgeIdentity;
import com.leanspec.sync.bridge.config.BridgeSettings;
import com.leanspec.sync.bridge.config.ProjectConfig;
import com.leanspec.sync.bridge.outbound.EventPublisher;
import com.leanspec.sync.bridge.outbound.EventSender;
import com.leanspec.sync.bridge.outbound.HttpEventPublisher;
import com.leanspec.sync.bridge.outbound.LocalEventQueue;
import com.leanspec.sync.bridge.outbound.QueuedEvent;
import com.leanspec.sync.bridge.spec.SpecRepository;
import com.leanspec.sync.bridge.watch.SpecDirectoryWatcher;
import com.leanspec.sync.core.event.SyncEvent;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;

/**
 * =====================================================================
 * SyncBridge
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Local agent that replicates spec files of one or more projects to the
 * sync server and executes the commands the server queues for this
 * machine.
 *
 * TASKS
 * -----
 *   watchers (one thread per project)  ──▶ EventSender ──▶ POST /events
 *   startup snapshot per project       ──▶ EventSender
 *   event heartbeat timer              ──▶ EventSender
 *   CommandChannel (WebSocket)         ──▶ CommandExecutor ──▶ result
 *                                                         └─▶ EventSender
 *
 * The sender is the only writer of the offline queue. The identity is
 * the only writer of bridge.json after startup.
 */
public class SyncBridge implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(SyncBridge.class);

    public static final Duration CHANNEL_HEARTBEAT_INTERVAL = Duration.ofSeconds(10);
    public static final Duration RECONNECT_DELAY = Duration.ofSeconds(5);
    public static final Duration EVENT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final BridgeSettings settings;
    private final Map<String, SpecRepository> repositories = new LinkedHashMap<>();
    private final LocalEventQueue queue;
    private final EventSender sender;
    private final CommandChannel channel;
    private final List<SpecDirectoryWatcher> watchers = new ArrayList<>();
    private final Duration eventHeartbeatInterval;

    private Disposable heartbeats;

    public SyncBridge(BridgeSettings settings, BridgeIdentity identity, ObjectMapper mapper,
                      WebClient webClient, WebSocketClient webSocketClient, Clock clock) {
        this(settings, identity, mapper, new HttpEventPublisher(webClient, identity), webSocketClient, clock,
                CHANNEL_HEARTBEAT_INTERVAL, RECONNECT_DELAY, EVENT_HEARTBEAT_INTERVAL);
    }

    SyncBridge(BridgeSettings settings, BridgeIdentity identity, ObjectMapper mapper, EventPublisher publisher,
               WebSocketClient webSocketClient, Clock clock, Duration channelHeartbeat,
               Duration reconnectDelay, Duration eventHeartbeat) {
        this.settings = settings;
        this.eventHeartbeatInterval = eventHeartbeat;
        for (ProjectConfig project : settings.projects()) {
            repositories.put(project.id(), new SpecRepository(project));
        }
        this.queue = new LocalEventQueue(settings.queueFile(), mapper);
        this.sender = new EventSender(publisher, queue);
        BridgeAuditLog audit = new BridgeAuditLog(settings.auditFile(), clock);
        CommandExecutor executor = new CommandExecutor(repositories, identity, audit, clock);
        this.channel = new CommandChannel(settings, identity, executor, sender, webSocketClient, mapper,
                channelHeartbeat, reconnectDelay);
    }

    /** WebClient bound to the server URL and using the shared JSON settings. */
    public static WebClient webClient(BridgeSettings settings, ObjectMapper mapper) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> {
                    codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
                    codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
                })
                .build();
        return WebClient.builder()
                .baseUrl(settings.serverUrl())
                .exchangeStrategies(strategies)
                .build();
    }

    public void start() {
        log.info("Starting bridge machine={} projects={} server={} queued={}",
                settings.machineId(), repositories.size(), settings.serverUrl(), queue.size());

        for (SpecRepository repository : repositories.values()) {
            ProjectConfig project = repository.project();
            SpecDirectoryWatcher watcher = new SpecDirectoryWatcher(repository,
                    event -> sender.submit(queued(project, event)));
            watcher.start();
            watchers.add(watcher);

            sender.submit(queued(project, new SyncEvent.Snapshot(repository.loadAll())));
        }

        heartbeats = Flux.interval(eventHeartbeatInterval, eventHeartbeatInterval)
                .subscribe(tick -> {
                    for (SpecRepository repository : repositories.values()) {
                        sender.submit(queued(repository.project(),
                                new SyncEvent.Heartbeat(settings.version(), sender.queueDepth())));
                    }
                });

        channel.start();
    }

    public int queueDepth() {
        return sender.queueDepth();
    }

    @Override
    public void close() {
        log.info("Stopping bridge machine={}", settings.machineId());
        channel.stop();
        if (heartbeats != null) {
            heartbeats.dispose();
        }
        watchers.forEach(SpecDirectoryWatcher::close);
        sender.close();
    }

    private static QueuedEvent queued(ProjectConfig project, SyncEvent event) {
        return new QueuedEvent(project.id(), project.name(), project.root().toString(), event);
    }
}
