package com.leanspec.sync.core.error;

/**
 * =====================================================================
 * SyncErrorKind
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Classifies every failure the sync subsystem can surface, on either side
 * of the wire. The kind decides how a failure propagates:
 *
 *   AUTH        missing / invalid / expired credential, revoked machine.
 *               No mutation happens.
 *   NOT_FOUND   unknown machine, project, spec, device or user code.
 *   CONFLICT    content hash mismatch on ApplyMetadata. Normally reported
 *               as a structured command result, not thrown.
 *   TRANSPORT   bridge could not reach the server. Absorbed by the local
 *               queue (events) or the reconnect loop (command channel).
 *   VALIDATION  malformed payload. The whole batch or command is rejected.
 */
public enum SyncErrorKind {
    AUTH,
    NOT_FOUND,
    CONFLICT,
    TRANSPORT,
    VALIDATION
}
