package com.leanspec.sync.bridge.outbound;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import com.leanspec.sync.bridge.config.BridgeIdentity;
import com.leanspec.sync.bridge.config.BridgeSettings;
import com.leanspec.sync.core.error.SyncException;
import com.leanspec.sync.core.event.SyncEventsRequest;

import reactor.core.publisher.Mono;

/**
 * Posts each event as a single-element batch to {@code /api/sync/events}. A 400 becomes a
 * {@code validation} error; every other failure is {@code transport} and may be retried.
 */
public class HttpEventPublisher implements EventPublisher {

    private final WebClient webClient;
    private final BridgeIdentity identity;

    public HttpEventPublisher(WebClient webClient, BridgeIdentity identity) {
        this.webClient = webClient;
        this.identity = identity;
    }

    @Override
    public Mono<Void> publish(QueuedEvent event) {
        return Mono.defer(() -> {
            SyncEventsRequest body = new SyncEventsRequest(identity.machineId(), identity.label(),
                    event.projectId(), event.projectName(), event.projectPath(), List.of(event.event()));
            return webClient.post()
                    .uri(BridgeSettings.EVENTS_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> identity.credential().ifPresent(c -> c.applyTo(headers)))
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(status -> status.value() == HttpStatus.BAD_REQUEST.value(),
                            response -> response.bodyToMono(String.class)
                                    .defaultIfEmpty("")
                                    .map(text -> SyncException.invalid("Server rejected event: " + text)))
                    .toBodilessEntity()
                    .then();
        }).onErrorMap(err -> !(err instanceof SyncException),
                err -> SyncException.transport("Event delivery failed: " + err.getMessage(), err));
    }
}
