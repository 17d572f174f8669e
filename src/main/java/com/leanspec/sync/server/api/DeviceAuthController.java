package com.leanspec.sync.server.api;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.leanspec.sync.server.auth.DeviceAuthorizationService;
import com.leanspec.sync.server.auth.DeviceCodeGrant;
import com.leanspec.sync.server.auth.TokenGrant;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Device authorization endpoints. Unauthenticated by design of the flow.
 */
@RestController
@RequestMapping(path = "/api/sync", produces = MediaType.APPLICATION_JSON_VALUE)
public class DeviceAuthController {

    public record DeviceCodeRequest(String machineLabel) {
    }

    public record ActivateRequest(@NotBlank String userCode) {
    }

    public record TokenRequest(@NotBlank String deviceCode) {
    }

    private final DeviceAuthorizationService devices;

    public DeviceAuthController(DeviceAuthorizationService devices) {
        this.devices = devices;
    }

    @PostMapping(path = "/device/code")
    public Mono<DeviceCodeGrant> requestCode(@RequestBody(required = false) DeviceCodeRequest request) {
        String label = request == null ? null : request.machineLabel();
        return Mono.fromCallable(() -> devices.requestDeviceCode(label))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping(path = "/device/activate", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> activate(@Valid @RequestBody ActivateRequest request) {
        return Mono.fromCallable(() -> devices.activate(request.userCode()))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(Map.<String, Object>of("success", true));
    }

    @PostMapping(path = "/oauth/token", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<TokenGrant> token(@Valid @RequestBody TokenRequest request) {
        return Mono.fromCallable(() -> devices.exchange(request.deviceCode()))
                .subscribeOn(Schedulers.boundedElastic());
    }
}
