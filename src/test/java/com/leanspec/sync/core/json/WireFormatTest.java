package com.leanspec.sync.core.json;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.leanspec.sync.core.channel.BridgeMessage;
import com.leanspec.sync.core.command.CommandStatus;
import com.leanspec.sync.core.command.PendingCommand;
import com.leanspec.sync.core.command.SyncCommand;
import com.leanspec.sync.core.event.SyncEvent;

class WireFormatTest {

    private final ObjectMapper mapper = JacksonConfig.newObjectMapper();

    @Test
    void pendingCommandCarriesTheCommandDiscriminant() throws Exception {
        PendingCommand pending = new PendingCommand("c1", new SyncCommand.RenameMachine("Desk"),
                Instant.parse("2025-03-01T10:00:00Z"));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(pending));

        assertThat(json.path("id").asText()).isEqualTo("c1");
        assertThat(json.path("command").path("type").asText()).isEqualTo("rename_machine");
        assertThat(json.path("command").path("label").asText()).isEqualTo("Desk");
        assertThat(json.path("createdAt").asText()).isEqualTo("2025-03-01T10:00:00Z");
    }

    @Test
    void bridgeFramesAreReadByType() throws Exception {
        BridgeMessage hello = mapper.readValue(
                "{\"type\":\"hello\",\"machineId\":\"m1\",\"machineLabel\":\"Laptop\",\"version\":\"1\"}",
                BridgeMessage.class);
        BridgeMessage result = mapper.readValue(
                "{\"type\":\"command_result\",\"commandId\":\"c1\",\"status\":\"conflict\",\"currentContentHash\":\"h\",\"extra\":1}",
                BridgeMessage.class);

        assertThat(hello).isEqualTo(new BridgeMessage.Hello("m1", "Laptop", "1"));
        assertThat(result).isEqualTo(new BridgeMessage.CommandResult("c1", CommandStatus.CONFLICT, null, "h"));
    }

    @Test
    void unknownResultStatusIsTreatedAsError() throws Exception {
        BridgeMessage result = mapper.readValue(
                "{\"type\":\"command_result\",\"commandId\":\"c1\",\"status\":\"exploded\"}", BridgeMessage.class);

        assertThat(((BridgeMessage.CommandResult) result).status()).isEqualTo(CommandStatus.ERROR);
    }

    @Test
    void eventsUseSnakeCaseDiscriminants() throws Exception {
        JsonNode deleted = mapper.readTree(mapper.writerFor(SyncEvent.class)
                .writeValueAsString(new SyncEvent.SpecDeleted("001-foo")));

        assertThat(deleted.path("type").asText()).isEqualTo("spec_deleted");
        assertThat(mapper.readValue("{\"type\":\"heartbeat\",\"version\":\"1\",\"queueDepth\":3}", SyncEvent.class))
                .isEqualTo(new SyncEvent.Heartbeat("1", 3));
    }
}
