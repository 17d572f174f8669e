package com.leanspec.sync.bridge.auth;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.leanspec.sync.bridge.config.BridgeConfigException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Bridge side of the device-code flow: request a code, show the user code, poll until the
 * operator approves it or it expires.
 */
public class DeviceAuthClient {

    private static final Logger log = LoggerFactory.getLogger(DeviceAuthClient.class);

    static final String AUTHORIZATION_PENDING = "authorization_pending";
    static final String EXPIRED_TOKEN = "expired_token";

    record DeviceCodeResponse(String deviceCode, String userCode, String verificationUri, long expiresIn, long interval) {
    }

    record TokenResponse(String accessToken, String tokenType, Long expiresIn) {
    }

    record ErrorBody(String error, String message) {
    }

    static final Duration CONNECT_RETRY_INTERVAL = Duration.ofSeconds(5);

    private final WebClient webClient;
    private final PrintWriter out;
    private final Duration connectRetryInterval;

    public DeviceAuthClient(WebClient webClient, PrintWriter out) {
        this(webClient, out, CONNECT_RETRY_INTERVAL);
    }

    DeviceAuthClient(WebClient webClient, PrintWriter out, Duration connectRetryInterval) {
        this.webClient = webClient;
        this.out = out;
        this.connectRetryInterval = connectRetryInterval;
    }

    /**
     * @return the approved access token
     * @throws BridgeConfigException when the code expires or the server rejects the flow
     */
    public String authorize(String machineLabel) {
        String token = requestCode(machineLabel)
                .flatMap(grant -> {
                    announce(grant);
                    return poll(grant);
                })
                .block();
        if (token == null) {
            throw new BridgeConfigException("Device authorization did not return a token");
        }
        return token;
    }

    Mono<DeviceCodeResponse> requestCode(String machineLabel) {
        Map<String, Object> body = machineLabel == null
                ? Collections.emptyMap()
                : Map.of("machineLabel", machineLabel);
        return webClient.post()
                .uri("/api/sync/device/code")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(DeviceCodeResponse.class)
                // Server not reachable yet: keep trying until it is.
                .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, connectRetryInterval)
                        .filter(WebClientRequestException.class::isInstance)
                        .doBeforeRetry(signal -> log.warn("Sync server unreachable, retrying in {}s: {}",
                                connectRetryInterval.toSeconds(), signal.failure().getMessage())))
                .onErrorMap(err -> !(err instanceof BridgeConfigException),
                        err -> new BridgeConfigException("Device code request failed: " + err.getMessage(), err));
    }

    Mono<String> poll(DeviceCodeResponse grant) {
        Duration interval = Duration.ofSeconds(Math.max(1, grant.interval()));
        Duration deadline = Duration.ofSeconds(Math.max(1, grant.expiresIn())).plus(interval);
        return Flux.interval(interval, interval)
                .concatMap(tick -> exchangeOnce(grant.deviceCode()))
                .next()
                .timeout(deadline)
                .onErrorMap(TimeoutException.class,
                        e -> new BridgeConfigException("Device authorization timed out; restart the bridge to retry"));
    }

    Mono<String> exchangeOnce(String deviceCode) {
        return webClient.post()
                .uri("/api/sync/oauth/token")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("deviceCode", deviceCode))
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(TokenResponse.class).map(TokenResponse::accessToken);
                    }
                    return response.bodyToMono(ErrorBody.class)
                            .defaultIfEmpty(new ErrorBody(null, null))
                            .flatMap(err -> {
                                if (AUTHORIZATION_PENDING.equals(err.error())) {
                                    return Mono.empty();
                                }
                                if (EXPIRED_TOKEN.equals(err.error())) {
                                    return Mono.error(new BridgeConfigException(
                                            "Device code expired; restart the bridge to request a new one"));
                                }
                                return Mono.error(new BridgeConfigException("Device authorization failed: "
                                        + response.statusCode().value() + " " + err.message()));
                            });
                })
                .onErrorResume(WebClientRequestException.class, e -> {
                    log.warn("Token poll failed, retrying: {}", e.getMessage());
                    return Mono.empty();
                });
    }

    private void announce(DeviceCodeResponse grant) {
        log.info("Waiting for device approval userCode={} expiresIn={}s", grant.userCode(), grant.expiresIn());
        out.printf("To authorize this machine, open %s and enter code: %s%n",
                grant.verificationUri(), grant.userCode());
        out.flush();
    }
}
