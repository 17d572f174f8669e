package com.leanspec.sync.server.api;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import com.leanspec.sync.core.error.SyncException;

/**
 * Maps failures to {@code {error, message}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<Map<String, String>> handleSync(SyncException e) {
        return ResponseEntity.status(statusOf(e)).body(body(e.code(), e.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, String>> handleBind(WebExchangeBindException e) {
        String message = e.getFieldErrors().stream()
                .map(err -> err.getField() + " " + err.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(body("invalid_request", message.isEmpty() ? e.getReason() : message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, String>> handleInput(ServerWebInputException e) {
        Throwable cause = e.getMostSpecificCause();
        if (cause instanceof SyncException sync) {
            return handleSync(sync);
        }
        return ResponseEntity.badRequest().body(body("invalid_request", e.getReason()));
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, String>> handleIo(UncheckedIOException e) {
        log.error("Persistence failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("persistence_error", e.getMessage()));
    }

    static HttpStatus statusOf(SyncException e) {
        switch (e.kind()) {
            case AUTH:
                return "machine_revoked".equals(e.code()) ? HttpStatus.FORBIDDEN : HttpStatus.UNAUTHORIZED;
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case TRANSPORT:
                return HttpStatus.BAD_GATEWAY;
            case VALIDATION:
            default:
                return HttpStatus.BAD_REQUEST;
        }
    }

    private static Map<String, String> body(String error, String message) {
        Map<String, String> out = new LinkedHashMap<>();
        out.put("error", error);
        out.put("message", message);
        return out;
    }
}
