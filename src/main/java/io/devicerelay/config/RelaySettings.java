package io.devicerelay.config;

import io.devicerelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the relay, read from {@code devicerelay-settings.json} in the data root.
 *
 * <p>Every field is optional in the file; missing or out-of-range values fall back to
 * {@link #defaults()} (clamped to a minimum where a zero would break the protocol).
 */
public record RelaySettings(
        String encryptionSecret,
        int commandCost,
        int freeCommandsPerDay,
        int maxPendingCommands,
        int maxDevicesPerUser,
        long commandTtlMs,
        long pairingCodeTtlMs,
        long longPollTimeoutMs,
        long pollIntervalMs,
        int claimLimit,
        long offlineAfterMs,
        List<String> workspaceRoots,
        int httpThreads,
        List<String> allowedOrigins,
        String auditSigningSecret
) {
    public static final String DEV_FALLBACK_SECRET = "devicerelay-default-dev-only";

    private static final Logger log = LoggerFactory.getLogger(RelaySettings.class);

    public RelaySettings {
        workspaceRoots = List.copyOf(workspaceRoots);
        allowedOrigins = List.copyOf(allowedOrigins);
    }

    public static RelaySettings defaults() {
        return new RelaySettings(
                "",
                10,
                0,
                20,
                5,
                60L * 60L * 1000L,
                10L * 60L * 1000L,
                30_000L,
                2_000L,
                10,
                5L * 60L * 1000L,
                List.of("~", "."),
                32,
                List.of("http://localhost:3000"),
                ""
        );
    }

    /**
     * Loads the settings file of {@code config} and applies the encryption key from the
     * environment, which wins over the file.
     */
    public static RelaySettings load(DeviceRelayConfig config) {
        return load(config.settingsFile(), System.getenv());
    }

    static RelaySettings load(Path file, Map<String, String> env) {
        RelaySettings defaults = defaults();
        RelaySettings resolved = defaults;
        if (Files.exists(file)) {
            try {
                SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
                resolved = fromFile(raw, defaults);
            } catch (IOException e) {
                throw new IllegalStateException("Failed to read relay settings: " + file, e);
            }
        }
        String envSecret = env == null ? null : env.get(DeviceRelayConfig.ENCRYPTION_KEY_ENV);
        if (envSecret != null && !envSecret.isBlank()) {
            resolved = resolved.withEncryptionSecret(envSecret.trim());
        }
        if (resolved.encryptionSecret().isBlank()) {
            log.warn("No encryption secret configured ({} or encryptionSecret); using the development fallback key",
                    DeviceRelayConfig.ENCRYPTION_KEY_ENV);
            resolved = resolved.withEncryptionSecret(DEV_FALLBACK_SECRET);
        }
        return resolved;
    }

    static RelaySettings fromFile(SettingsFile file, RelaySettings defaults) {
        if (file == null) {
            return defaults;
        }
        long pollInterval = sanitizeLong(file.pollIntervalMs(), defaults.pollIntervalMs(), 10L);
        long longPollTimeout = sanitizeLong(file.longPollTimeoutMs(), defaults.longPollTimeoutMs(), 0L);
        return new RelaySettings(
                sanitizeString(file.encryptionSecret(), defaults.encryptionSecret()),
                sanitizeInt(file.commandCost(), defaults.commandCost(), 0),
                sanitizeInt(file.freeCommandsPerDay(), defaults.freeCommandsPerDay(), 0),
                sanitizeInt(file.maxPendingCommands(), defaults.maxPendingCommands(), 1),
                sanitizeInt(file.maxDevicesPerUser(), defaults.maxDevicesPerUser(), 1),
                sanitizeLong(file.commandTtlMs(), defaults.commandTtlMs(), 1_000L),
                sanitizeLong(file.pairingCodeTtlMs(), defaults.pairingCodeTtlMs(), 1_000L),
                longPollTimeout,
                pollInterval,
                sanitizeInt(file.claimLimit(), defaults.claimLimit(), 1),
                sanitizeLong(file.offlineAfterMs(), defaults.offlineAfterMs(), 1_000L),
                sanitizeList(file.workspaceRoots(), defaults.workspaceRoots()),
                sanitizeInt(file.httpThreads(), defaults.httpThreads(), 2),
                sanitizeList(file.allowedOrigins(), defaults.allowedOrigins()),
                sanitizeString(file.auditSigningSecret(), defaults.auditSigningSecret())
        );
    }

    public RelaySettings withEncryptionSecret(String secret) {
        return new RelaySettings(secret, commandCost, freeCommandsPerDay, maxPendingCommands, maxDevicesPerUser,
                commandTtlMs, pairingCodeTtlMs, longPollTimeoutMs, pollIntervalMs, claimLimit, offlineAfterMs,
                workspaceRoots, httpThreads, allowedOrigins, auditSigningSecret);
    }

    public RelaySettings withPolling(long longPollTimeoutMs, long pollIntervalMs) {
        return new RelaySettings(encryptionSecret, commandCost, freeCommandsPerDay, maxPendingCommands,
                maxDevicesPerUser, commandTtlMs, pairingCodeTtlMs, longPollTimeoutMs, pollIntervalMs, claimLimit,
                offlineAfterMs, workspaceRoots, httpThreads, allowedOrigins, auditSigningSecret);
    }

    public RelaySettings withBilling(int commandCost, int freeCommandsPerDay, int maxPendingCommands) {
        return new RelaySettings(encryptionSecret, commandCost, freeCommandsPerDay, maxPendingCommands,
                maxDevicesPerUser, commandTtlMs, pairingCodeTtlMs, longPollTimeoutMs, pollIntervalMs, claimLimit,
                offlineAfterMs, workspaceRoots, httpThreads, allowedOrigins, auditSigningSecret);
    }

    /** Never exposes the secrets. */
    @Override
    public String toString() {
        return "RelaySettings[commandCost=" + commandCost
                + ", freeCommandsPerDay=" + freeCommandsPerDay
                + ", maxPendingCommands=" + maxPendingCommands
                + ", maxDevicesPerUser=" + maxDevicesPerUser
                + ", commandTtlMs=" + commandTtlMs
                + ", longPollTimeoutMs=" + longPollTimeoutMs
                + ", pollIntervalMs=" + pollIntervalMs
                + ", claimLimit=" + claimLimit
                + ", workspaceRoots=" + workspaceRoots + "]";
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeString(String raw, String fallback) {
        if (raw == null) {
            return fallback == null ? "" : fallback;
        }
        return raw.trim();
    }

    private static List<String> sanitizeList(List<String> raw, List<String> fallback) {
        if (raw == null) {
            return fallback;
        }
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return out.isEmpty() ? fallback : out;
    }

    record SettingsFile(
            String encryptionSecret,
            Integer commandCost,
            Integer freeCommandsPerDay,
            Integer maxPendingCommands,
            Integer maxDevicesPerUser,
            Long commandTtlMs,
            Long pairingCodeTtlMs,
            Long longPollTimeoutMs,
            Long pollIntervalMs,
            Integer claimLimit,
            Long offlineAfterMs,
            List<String> workspaceRoots,
            Integer httpThreads,
            List<String> allowedOrigins,
            String auditSigningSecret
    ) {
    }
}
