package io.devicerelay.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static RiskLevel fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return LOW;
        }
        return RiskLevel.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
