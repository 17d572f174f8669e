package com.leanspec.sync.bridge.outbound;

import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * EventPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for delivering one outbound event to the
 * sync server.
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ watcher / snapshot / command follow-up ]
 *          │
 *          ▼
 *   [ EventSender ]  ── on failure ──▶ [ LocalEventQueue ]
 *          │
 *          ▼
 *   [ EventPublisher ]  ← YOU ARE HERE
 *          │
 *          ▼
 *   [ POST /api/sync/events ]
 *
 * It deliberately knows NOTHING about queueing or retry; the sender
 * owns both.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Mono completes: the server accepted and applied the event.
 * - Mono errors: the event was NOT applied; the caller keeps it.
 *
 * Server application is idempotent, so re-sending an event whose
 * response was lost is safe.
 */
public interface EventPublisher {

    Mono<Void> publish(QueuedEvent event);
}
