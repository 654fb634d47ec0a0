package io.devicerelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a relay command.
 *
 * <p>{@link #DELIVERED} is never stored: it is how a claimed {@link #PENDING} command reads
 * until the device reports its first progress event.
 */
public enum CommandStatus {
    AWAITING_CONFIRMATION,
    PENDING,
    DELIVERED,
    EXECUTING,
    COMPLETED,
    FAILED,
    CANCELLED,
    EXPIRED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == EXPIRED;
    }

    public static CommandStatus fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command status must not be blank");
        }
        return CommandStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Device-reported outcome: only an explicit {@code failed} fails the command.
     */
    public static CommandStatus fromDeviceOutcome(String raw) {
        if (raw != null && "failed".equalsIgnoreCase(raw.trim())) {
            return FAILED;
        }
        return COMPLETED;
    }

    /**
     * Status as an operator or device should see it at {@code nowMs}: every overdue
     * non-terminal command reads as expired, claimed or not; claimed pending commands read
     * as delivered.
     */
    public static CommandStatus effective(CommandStatus stored, boolean claimed, long expiresAtMs, long nowMs) {
        if (stored.terminal()) {
            return stored;
        }
        if (nowMs > expiresAtMs) {
            return EXPIRED;
        }
        if (stored == PENDING && claimed) {
            return DELIVERED;
        }
        return stored;
    }
}
