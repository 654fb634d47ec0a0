package io.devicerelay.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Plaintext command as the device executes it. Serialized to JSON and encrypted before it
 * is stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandPayload(CommandType type, String command, Integer timeout) {
    public static final int DEFAULT_SHELL_TIMEOUT_SECONDS = 60;

    public static CommandPayload of(CommandType type, String command) {
        return new CommandPayload(type, command, null);
    }

    public static CommandPayload shell(String command) {
        return new CommandPayload(CommandType.SHELL, command, DEFAULT_SHELL_TIMEOUT_SECONDS);
    }
}
