package com.leanspec.sync.server.api;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.databind.JsonNode;
import com.leanspec.sync.core.command.PendingCommand;
import com.leanspec.sync.core.command.SyncCommand;
import com.leanspec.sync.server.audit.AuditLogStore;
import com.leanspec.sync.server.command.CommandService;
import com.leanspec.sync.server.registry.MachineRegistry;
import com.leanspec.sync.server.registry.MachineSummary;
import com.leanspec.sync.server.ws.BridgeSessionRegistry;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Operator-facing machine management: listing, rename, revoke, metadata edits and execution
 * requests. Every mutating call queues a command for the machine.
 */
@RestController
@RequestMapping(path = "/api/sync/machines", produces = MediaType.APPLICATION_JSON_VALUE)
public class MachineController {

    public record RenameRequest(@NotBlank String label) {
    }

    public record ExecutionBody(JsonNode payload) {
    }

    public record MetadataRequest(
            String status,
            String priority,
            List<String> tags,
            List<String> addDependsOn,
            List<String> removeDependsOn,
            String parent,
            String expectedContentHash) {
    }

    private final MachineRegistry registry;
    private final BridgeSessionRegistry sessions;
    private final CommandService commands;
    private final AuditLogStore audit;

    public MachineController(MachineRegistry registry, BridgeSessionRegistry sessions,
                             CommandService commands, AuditLogStore audit) {
        this.registry = registry;
        this.sessions = sessions;
        this.commands = commands;
        this.audit = audit;
    }

    @GetMapping
    public Mono<Map<String, Object>> list() {
        return Mono.fromCallable(() -> registry.listMachines(sessions::isConnected))
                .subscribeOn(Schedulers.boundedElastic())
                .map(machines -> Map.<String, Object>of("machines", machines));
    }

    @PatchMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<MachineSummary> rename(@PathVariable String id, @Valid @RequestBody RenameRequest request) {
        return commands.rename(id, request.label())
                .then(Mono.fromCallable(() -> registry.summary(id, sessions::isConnected))
                        .subscribeOn(Schedulers.boundedElastic()));
    }

    @DeleteMapping(path = "/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> revoke(@PathVariable String id) {
        return commands.revoke(id).then();
    }

    @PostMapping(path = "/{id}/execution", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> execute(@PathVariable String id, @RequestBody ExecutionBody body) {
        SyncCommand command = new SyncCommand.ExecutionRequest(UUID.randomUUID().toString(), body.payload());
        return commands.issue(id, command)
                .map(pending -> Map.<String, Object>of("success", true, "commandId", pending.id()));
    }

    @PostMapping(path = "/{id}/projects/{projectId}/specs/{specName}/metadata",
            consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<PendingCommand> applyMetadata(@PathVariable String id, @PathVariable String projectId,
                                              @PathVariable String specName, @RequestBody MetadataRequest request) {
        return Mono.fromCallable(() -> new SyncCommand.ApplyMetadata(projectId, specName, request.status(),
                        request.priority(), request.tags(), request.addDependsOn(), request.removeDependsOn(),
                        request.parent(), request.expectedContentHash()))
                .flatMap(command -> commands.issue(id, command));
    }

    @GetMapping(path = "/{id}/projects")
    public Mono<Map<String, Object>> projects(@PathVariable String id) {
        return Mono.fromCallable(() -> registry.projects(id).stream()
                        .map(ProjectView::of)
                        .collect(Collectors.toList()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(projects -> Map.<String, Object>of("projects", projects));
    }

    @GetMapping(path = "/{id}/commands")
    public Mono<Map<String, Object>> pending(@PathVariable String id) {
        return Mono.fromCallable(() -> {
                    registry.summary(id, sessions::isConnected);
                    return registry.pendingCommands(id);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(pending -> Map.<String, Object>of("commands", pending));
    }

    @GetMapping(path = "/{id}/audit")
    public Mono<Map<String, Object>> audit(@PathVariable String id,
                                           @RequestParam(name = "limit", defaultValue = "100") int limit) {
        return audit.findByMachine(id, Math.max(1, Math.min(limit, 1000)))
                .collectList()
                .map(entries -> Map.<String, Object>of("entries", entries));
    }
}
