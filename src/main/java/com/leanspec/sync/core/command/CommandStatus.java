package com.leanspec.sync.core.command;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome reported by the bridge for one executed command.
 */
public enum CommandStatus {

    OK("ok"),

    /** Expected content hash did not match; nothing was changed. */
    CONFLICT("conflict"),

    ERROR("error");

    private final String wire;

    CommandStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    /** Unknown values from newer bridges are recorded as {@link #ERROR}. */
    @JsonCreator
    public static CommandStatus fromWire(String value) {
        if (value == null) {
            return ERROR;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CommandStatus status : values()) {
            if (status.wire.equals(normalized)) {
                return status;
            }
        }
        return ERROR;
    }
}
