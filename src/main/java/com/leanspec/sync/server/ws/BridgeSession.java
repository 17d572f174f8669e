package com.leanspec.sync.server.ws;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.socket.WebSocketSession;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.core.command.PendingCommand;

import reactor.core.publisher.Sinks;

/**
 * One live command channel bound to a machine id after its Hello.
 *
 * <p>Frames are pushed through a unicast sink drained by the socket's outbound stream.
 * {@link #send(PendingCommand)} may be called from any thread; emission is serialized here.</p>
 */
public class BridgeSession {

    private static final Logger log = LoggerFactory.getLogger(BridgeSession.class);

    private final String machineId;
    private final WebSocketSession socket;
    private final Sinks.Many<String> outbound;
    private final ObjectMapper mapper;

    public BridgeSession(String machineId, WebSocketSession socket, Sinks.Many<String> outbound, ObjectMapper mapper) {
        this.machineId = machineId;
        this.socket = socket;
        this.outbound = outbound;
        this.mapper = mapper;
    }

    /**
     * @return false when the frame could not be handed to the socket; the command stays queued
     *         and is replayed on the next Hello
     */
    public boolean send(PendingCommand command) {
        String json;
        try {
            json = mapper.writeValueAsString(command);
        } catch (JsonProcessingException e) {
            log.error("Failed to encode command id={} machine={}", command.id(), machineId, e);
            return false;
        }
        Sinks.EmitResult result;
        synchronized (this) {
            result = outbound.tryEmitNext(json);
        }
        if (result.isFailure()) {
            log.warn("Command id={} not pushed to machine={} result={}", command.id(), machineId, result);
            return false;
        }
        return true;
    }

    public void close() {
        synchronized (this) {
            outbound.tryEmitComplete();
        }
        socket.close().subscribe(
                null,
                err -> log.debug("Closing socket of machine={} failed: {}", machineId, err.toString()));
    }

    public String machineId() {
        return machineId;
    }

    public String socketId() {
        return socket.getId();
    }
}
