package io.devicerelay.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CommandType {
    SHELL,
    FILE_READ,
    FILE_LIST,
    BROWSER_OPEN,
    CLIPBOARD,
    SCREENSHOT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CommandType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command type must not be blank");
        }
        return CommandType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
