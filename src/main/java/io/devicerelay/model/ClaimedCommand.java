package io.devicerelay.model;

public record ClaimedCommand(
        String commandId,
        String encryptedCommand,
        String iv,
        String authTag,
        int priority,
        long createdAtMs
) {
}
