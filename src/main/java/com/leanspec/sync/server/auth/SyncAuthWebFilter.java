package com.leanspec.sync.server.auth;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.core.error.SyncException;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Guards every {@code /api/sync/**} route, including the bridge WebSocket handshake. The device
 * flow endpoints stay open because they are how a bridge obtains a credential in the first place.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class SyncAuthWebFilter implements WebFilter {

    private static final Logger log = LoggerFactory.getLogger(SyncAuthWebFilter.class);

    private static final String PROTECTED_PREFIX = "/api/sync/";

    private final SyncAuthenticator authenticator;
    private final ObjectMapper mapper;

    public SyncAuthWebFilter(SyncAuthenticator authenticator, ObjectMapper mapper) {
        this.authenticator = authenticator;
        this.mapper = mapper;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!requiresAuth(path)) {
            return chain.filter(exchange);
        }
        return Mono.fromCallable(() -> {
                    authenticator.authenticate(exchange.getRequest().getHeaders());
                    return Boolean.TRUE;
                })
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(SyncException.class, e -> reject(exchange, path, e).thenReturn(Boolean.FALSE))
                .flatMap(allowed -> allowed ? chain.filter(exchange) : Mono.empty());
    }

    static boolean requiresAuth(String path) {
        return path.startsWith(PROTECTED_PREFIX)
                && !path.startsWith("/api/sync/device/")
                && !path.startsWith("/api/sync/oauth/");
    }

    private Mono<Void> reject(ServerWebExchange exchange, String path, SyncException e) {
        log.debug("Rejected {} {}: {}", exchange.getRequest().getMethod(), path, e.getMessage());
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);

        Map<String, String> body = new LinkedHashMap<>();
        body.put("error", e.code());
        body.put("message", e.getMessage());
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException ex) {
            bytes = ("{\"error\":\"" + e.code() + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
