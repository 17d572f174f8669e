package com.leanspec.sync.bridge.command;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import org.springframework.web.reactive.socket.client.WebSocketClient;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.leanspec.sync.bridge.config.BridgeIdentity;
import com.leanspec.sync.bridge.config.BridgeSettings;
import com.leanspec.sync.bridge.outbound.EventSender;
import com.leanspec.sync.core.channel.BridgeMessage;
import com.leanspec.sync.core.command.CommandStatus;
import com.leanspec.sync.core.command.PendingCommand;

import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Long-lived command channel to the server.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>Connect with the current credential, send {@code hello}, then a {@code heartbeat} with the
 *       offline-queue depth every heartbeat interval.</li>
 *   <li>Every received command yields exactly one {@code command_result}. A command id already
 *       executed in this process is answered with the stored result instead of running again.</li>
 *   <li>On error or close, wait the reconnect delay and start over with a fresh hello; the server
 *       replays everything not yet acknowledged.</li>
 * </ul>
 */
public class CommandChannel {

    private static final Logger log = LoggerFactory.getLogger(CommandChannel.class);

    private static final int RECENT_RESULTS = 256;

    private final BridgeSettings settings;
    private final BridgeIdentity identity;
    private final CommandExecutor executor;
    private final EventSender sender;
    private final WebSocketClient client;
    private final ObjectMapper mapper;
    private final ObjectWriter messageWriter;
    private final Duration heartbeatInterval;
    private final Duration reconnectDelay;

    /** Holds the running loop so start/stop is idempotent. */
    private final AtomicReference<Disposable> running = new AtomicReference<>();

    private final Map<String, BridgeMessage.CommandResult> recentResults =
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, BridgeMessage.CommandResult> eldest) {
                    return size() > RECENT_RESULTS;
                }
            };

    public CommandChannel(BridgeSettings settings, BridgeIdentity identity, CommandExecutor executor,
                          EventSender sender, WebSocketClient client, ObjectMapper mapper,
                          Duration heartbeatInterval, Duration reconnectDelay) {
        this.settings = settings;
        this.identity = identity;
        this.executor = executor;
        this.sender = sender;
        this.client = client;
        this.mapper = mapper;
        this.messageWriter = mapper.writerFor(BridgeMessage.class);
        this.heartbeatInterval = heartbeatInterval;
        this.reconnectDelay = reconnectDelay;
    }

    public void start() {
        if (running.get() != null) {
            return;
        }
        Disposable loop = Mono.defer(this::connectOnce)
                .onErrorResume(err -> {
                    log.warn("Command channel disconnected: {}. Reconnecting in {}s",
                            err.toString(), reconnectDelay.toSeconds());
                    return Mono.empty();
                })
                .then(Mono.delay(reconnectDelay))
                .repeat()
                .subscribe(
                        v -> { },
                        err -> log.error("Command channel supervisor terminated unexpectedly: {}", err.toString(), err));
        if (!running.compareAndSet(null, loop)) {
            loop.dispose();
        }
    }

    public void stop() {
        Disposable loop = running.getAndSet(null);
        if (loop != null && !loop.isDisposed()) {
            loop.dispose();
        }
    }

    Mono<Void> connectOnce() {
        HttpHeaders headers = new HttpHeaders();
        identity.credential().ifPresent(c -> c.applyTo(headers));
        log.info("Connecting command channel {}", settings.channelUri());
        return client.execute(settings.channelUri(), headers, this::serve)
                .doOnSuccess(v -> log.info("Command channel closed by server"));
    }

    private Mono<Void> serve(WebSocketSession session) {
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();

        emit(outbound, new BridgeMessage.Hello(identity.machineId(), identity.label(), settings.version()));

        Disposable heartbeats = Flux.interval(heartbeatInterval, heartbeatInterval)
                .subscribe(tick -> emit(outbound, new BridgeMessage.Heartbeat(sender.queueDepth())));

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> onCommand(outbound, text))
                .then()
                .doFinally(signal -> {
                    synchronized (outbound) {
                        outbound.tryEmitComplete();
                    }
                });

        Mono<Void> output = session.send(outbound.asFlux().map(session::textMessage));

        return Mono.when(input, output)
                .doFinally(signal -> heartbeats.dispose());
    }

    Mono<Void> onCommand(Sinks.Many<String> outbound, String text) {
        PendingCommand pending;
        try {
            pending = mapper.readValue(text, PendingCommand.class);
        } catch (JsonProcessingException e) {
            rejectUndecodable(outbound, text, e);
            return Mono.empty();
        }

        BridgeMessage.CommandResult previous = recentResult(pending.id());
        if (previous != null) {
            log.debug("Command {} already executed; re-sending its result", pending.id());
            emit(outbound, previous);
            return Mono.empty();
        }

        return Mono.fromCallable(() -> executor.execute(pending))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(outcome -> {
                    BridgeMessage.CommandResult result = new BridgeMessage.CommandResult(
                            pending.id(), outcome.status(), outcome.message(), outcome.currentContentHash());
                    remember(result);
                    emit(outbound, result);
                    log.info("Command {} ({}) -> {}", pending.id(), pending.command().action(), outcome.status().wire());
                    if (outcome.followUp() != null) {
                        sender.submit(outcome.followUp());
                    }
                })
                .then();
    }

    /** A frame that still carries an id is answered with an error so the server stops replaying it. */
    private void rejectUndecodable(Sinks.Many<String> outbound, String text, JsonProcessingException cause) {
        String commandId;
        try {
            commandId = mapper.readTree(text).path("id").asText("");
        } catch (JsonProcessingException e) {
            commandId = "";
        }
        if (commandId.isBlank()) {
            log.warn("Ignoring command frame without id: {}", cause.getOriginalMessage());
            return;
        }
        log.warn("Command {} could not be decoded: {}", commandId, cause.getOriginalMessage());
        BridgeMessage.CommandResult result = new BridgeMessage.CommandResult(commandId, CommandStatus.ERROR,
                "Unsupported or invalid command: " + cause.getOriginalMessage(), null);
        remember(result);
        emit(outbound, result);
    }

    private void emit(Sinks.Many<String> outbound, BridgeMessage message) {
        String json;
        try {
            json = messageWriter.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode {}", message.getClass().getSimpleName(), e);
            return;
        }
        Sinks.EmitResult result;
        synchronized (outbound) {
            result = outbound.tryEmitNext(json);
        }
        if (result.isFailure()) {
            log.debug("Frame {} not sent: {}", message.getClass().getSimpleName(), result);
        }
    }

    private synchronized BridgeMessage.CommandResult recentResult(String commandId) {
        return recentResults.get(commandId);
    }

    private synchronized void remember(BridgeMessage.CommandResult result) {
        recentResults.put(result.commandId(), result);
    }
}
