package com.leanspec.sync.core.error;

/**
 * Runtime failure carrying a {@link SyncErrorKind} and a short machine-readable code.
 *
 * <p>The code ends up in the {@code error} field of HTTP error bodies
 * (e.g. {@code authorization_pending}, {@code machine_revoked}).</p>
 */
public class SyncException extends RuntimeException {

    private final SyncErrorKind kind;
    private final String code;

    public SyncException(SyncErrorKind kind, String code, String message) {
        super(message);
        this.kind = kind;
        this.code = code;
    }

    public SyncException(SyncErrorKind kind, String code, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.code = code;
    }

    public SyncErrorKind kind() {
        return kind;
    }

    public String code() {
        return code;
    }

    public static SyncException unauthorized(String message) {
        return new SyncException(SyncErrorKind.AUTH, "unauthorized", message);
    }

    public static SyncException revoked(String machineId) {
        return new SyncException(SyncErrorKind.AUTH, "machine_revoked", "Machine revoked: " + machineId);
    }

    public static SyncException notFound(String what, String id) {
        return new SyncException(SyncErrorKind.NOT_FOUND, "not_found", what + " not found: " + id);
    }

    public static SyncException invalid(String message) {
        return new SyncException(SyncErrorKind.VALIDATION, "invalid_request", message);
    }

    public static SyncException transport(String message, Throwable cause) {
        return new SyncException(SyncErrorKind.TRANSPORT, "transport_error", message, cause);
    }
}
