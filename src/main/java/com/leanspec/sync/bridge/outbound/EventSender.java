package com.leanspec.sync.bridge.outbound;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.leanspec.sync.core.error.SyncErrorKind;
import com.leanspec.sync.core.error.SyncException;

import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

/**
 * Single ordered outbound pipeline.
 *
 * <h2>Delivery rule</h2>
 * <ul>
 *   <li>Queue empty: try the event; on success flush (no-op), on failure append it to the queue.</li>
 *   <li>Queue non-empty: append the event behind the backlog, then flush oldest first. Order across
 *       restarts and outages is the order events were produced.</li>
 *   <li>Flush stops at the first failure; the next event (or heartbeat) retries it.</li>
 * </ul>
 *
 * All queue access happens on this pipeline, one event at a time ({@code concatMap}).
 */
public class EventSender {

    private static final Logger log = LoggerFactory.getLogger(EventSender.class);

    private final EventPublisher publisher;
    private final LocalEventQueue queue;
    private final Sinks.Many<QueuedEvent> inbox = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable subscription;

    public EventSender(EventPublisher publisher, LocalEventQueue queue) {
        this.publisher = publisher;
        this.queue = queue;
        this.subscription = inbox.asFlux()
                .publishOn(Schedulers.boundedElastic())
                .concatMap(event -> deliver(event)
                        .onErrorResume(err -> {
                            log.error("Outbound pipeline error for project={}: {}", event.projectId(), err.toString(), err);
                            return Mono.empty();
                        }))
                .subscribe();
    }

    /** Thread-safe; may be called from watchers, the command channel and timers. */
    public void submit(QueuedEvent event) {
        Sinks.EmitResult result;
        synchronized (this) {
            result = inbox.tryEmitNext(event);
        }
        if (result.isFailure()) {
            log.warn("Dropping outbound event for project={}: sender is {}", event.projectId(), result);
        }
    }

    public int queueDepth() {
        return queue.size();
    }

    Mono<Void> deliver(QueuedEvent event) {
        if (!queue.isEmpty()) {
            if (event.isPersistable()) {
                queue.append(event);
            }
            return flush();
        }
        return publisher.publish(event)
                .then(flush())
                .onErrorResume(err -> {
                    if (isRejected(err)) {
                        log.error("Server rejected event for project={}, dropping it: {}",
                                event.projectId(), err.getMessage());
                        return Mono.empty();
                    }
                    if (event.isPersistable()) {
                        queue.append(event);
                        log.warn("Failed to send event, queued (depth={}): {}", queue.size(), err.getMessage());
                    } else {
                        log.debug("Heartbeat not delivered: {}", err.getMessage());
                    }
                    return Mono.empty();
                });
    }

    Mono<Void> flush() {
        return Mono.defer(() -> queue.peek()
                .map(head -> publisher.publish(head)
                        .then(Mono.fromRunnable(() -> queue.removeHead(head)))
                        .then(flush())
                        .onErrorResume(err -> {
                            if (isRejected(err)) {
                                log.error("Server rejected queued event for project={}, dropping it: {}",
                                        head.projectId(), err.getMessage());
                                queue.removeHead(head);
                                return flush();
                            }
                            log.debug("Flush stopped with {} event(s) queued: {}", queue.size(), err.getMessage());
                            return Mono.empty();
                        }))
                .orElseGet(Mono::empty));
    }

    /** The server refused the event itself; sending it again cannot succeed. */
    static boolean isRejected(Throwable err) {
        return err instanceof SyncException e && e.kind() == SyncErrorKind.VALIDATION;
    }

    public void close() {
        synchronized (this) {
            inbox.tryEmitComplete();
        }
        if (!subscription.isDisposed()) {
            subscription.dispose();
        }
    }
}
