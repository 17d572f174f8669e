package com.leanspec.sync.server.api;

import java.util.Map;

import jakarta.validation.Valid;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.leanspec.sync.core.event.SyncEventsRequest;
import com.leanspec.sync.server.registry.MachineRegistry;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping(path = "/api/sync", produces = MediaType.APPLICATION_JSON_VALUE)
public class SyncEventsController {

    private final MachineRegistry registry;

    public SyncEventsController(MachineRegistry registry) {
        this.registry = registry;
    }

    @PostMapping(path = "/events", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> ingest(@Valid @RequestBody SyncEventsRequest request) {
        return Mono.fromRunnable(() -> registry.ingestEvents(request))
                .subscribeOn(Schedulers.boundedElastic())
                .thenReturn(Map.<String, Object>of("success", true));
    }
}
