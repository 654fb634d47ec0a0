package io.devicerelay.model;

import java.util.List;

/**
 * A stored command row. {@code status} is the stored value; use {@link #effectiveStatus(long)}
 * for anything shown to a caller.
 */
public record CommandRecord(
        String commandId,
        String userId,
        String targetDeviceId,
        String targetDeviceName,
        String encryptedCommand,
        String iv,
        String authTag,
        CommandStatus status,
        int priority,
        RiskLevel riskLevel,
        List<String> safetyWarnings,
        String commandPreview,
        String encryptedResult,
        String resultIv,
        String resultAuthTag,
        String resultSummary,
        int creditsCharged,
        long createdAtMs,
        Long deliveredAtMs,
        Long completedAtMs,
        long expiresAtMs
) {
    public boolean claimed() {
        return deliveredAtMs != null;
    }

    public CommandStatus effectiveStatus(long nowMs) {
        return CommandStatus.effective(status, claimed(), expiresAtMs, nowMs);
    }

    public boolean hasEncryptedResult() {
        return encryptedResult != null && !encryptedResult.isBlank()
                && resultIv != null && !resultIv.isBlank()
                && resultAuthTag != null && !resultAuthTag.isBlank();
    }
}
