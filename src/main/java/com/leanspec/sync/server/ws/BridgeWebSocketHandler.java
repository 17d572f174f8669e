package com.leanspec.sync.server.ws;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.core.channel.BridgeMessage;
import com.leanspec.sync.core.command.PendingCommand;
import com.leanspec.sync.core.command.SyncCommand;
import com.leanspec.sync.server.command.CommandService;
import com.leanspec.sync.server.registry.MachineRegistry;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Server side of the bridge command channel ({@code /api/sync/bridge/ws}).
 *
 * <h2>Protocol</h2>
 * <ol>
 *   <li>The handshake is authenticated by {@code SyncAuthWebFilter} like every other sync route.</li>
 *   <li>The first meaningful frame is {@code hello}: the machine is ensured, the session bound, and
 *       every pending command for it is replayed oldest first.</li>
 *   <li>{@code heartbeat} refreshes the machine's last-seen time.</li>
 *   <li>{@code command_result} acknowledges one command by id.</li>
 * </ol>
 * Frames received before {@code hello} are ignored. Undecodable frames are logged and skipped;
 * they never close the channel.
 */
@Component
public class BridgeWebSocketHandler implements WebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(BridgeWebSocketHandler.class);

    private final MachineRegistry registry;
    private final BridgeSessionRegistry sessions;
    private final CommandService commands;
    private final ObjectMapper mapper;

    public BridgeWebSocketHandler(MachineRegistry registry, BridgeSessionRegistry sessions,
                                  CommandService commands, ObjectMapper mapper) {
        this.registry = registry;
        this.sessions = sessions;
        this.commands = commands;
        this.mapper = mapper;
    }

    @Override
    public Mono<Void> handle(WebSocketSession socket) {
        Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        AtomicReference<BridgeSession> bound = new AtomicReference<>();

        Mono<Void> input = socket.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(text -> onFrame(socket, outbound, bound, text)
                        .onErrorResume(err -> {
                            log.warn("Failed to handle frame on socket={}: {}", socket.getId(), err.toString());
                            return Mono.empty();
                        }))
                .then()
                .doFinally(signal -> {
                    synchronized (bound) {
                        BridgeSession session = bound.get();
                        if (session != null) {
                            sessions.unregister(session);
                        }
                    }
                    outbound.tryEmitComplete();
                });

        Mono<Void> output = socket.send(outbound.asFlux().map(socket::textMessage));

        return Mono.when(input, output);
    }

    private Mono<Void> onFrame(WebSocketSession socket, Sinks.Many<String> outbound,
                               AtomicReference<BridgeSession> bound, String text) {
        BridgeMessage message;
        try {
            message = mapper.readValue(text, BridgeMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("Ignoring undecodable frame on socket={}: {}", socket.getId(), e.getOriginalMessage());
            return Mono.empty();
        }

        if (message instanceof BridgeMessage.Hello hello) {
            return onHello(socket, outbound, bound, hello);
        }

        BridgeSession session = bound.get();
        if (session == null) {
            log.debug("Ignoring {} before hello on socket={}", message.getClass().getSimpleName(), socket.getId());
            return Mono.empty();
        }
        if (message instanceof BridgeMessage.Heartbeat heartbeat) {
            log.debug("Heartbeat machine={} queueDepth={}", session.machineId(), heartbeat.queueDepth());
            return Mono.fromRunnable(() -> registry.touch(session.machineId()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .then();
        }
        if (message instanceof BridgeMessage.CommandResult result) {
            return commands.acknowledge(session.machineId(), result).then();
        }
        return Mono.empty();
    }

    private Mono<Void> onHello(WebSocketSession socket, Sinks.Many<String> outbound,
                               AtomicReference<BridgeSession> bound, BridgeMessage.Hello hello) {
        if (hello.machineId() == null || hello.machineId().isBlank()) {
            log.warn("Ignoring hello without machineId on socket={}", socket.getId());
            return Mono.empty();
        }
        return Mono.fromCallable(() -> {
                    registry.ensureMachine(hello.machineId(), hello.machineLabel());
                    BridgeSession session = new BridgeSession(hello.machineId(), socket, outbound, mapper);
                    synchronized (bound) {
                        BridgeSession previous = bound.getAndSet(session);
                        if (previous != null && !previous.machineId().equals(session.machineId())) {
                            sessions.unregister(previous);
                        }
                        sessions.register(session);
                    }
                    List<PendingCommand> pending = registry.pendingCommands(hello.machineId());
                    if (registry.isRevoked(hello.machineId())) {
                        // Only the revocation itself still reaches a revoked machine.
                        pending = pending.stream()
                                .filter(command -> command.command() instanceof SyncCommand.RevokeMachine)
                                .collect(Collectors.toList());
                    }
                    log.info("Hello machine={} label={} version={} replaying={}",
                            hello.machineId(), hello.machineLabel(), hello.version(), pending.size());
                    for (PendingCommand command : pending) {
                        session.send(command);
                    }
                    return session;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .then();
    }
}
