package io.devicerelay.runtime;

import io.devicerelay.config.RelaySettings;
import io.devicerelay.model.ClaimedCommand;
import io.devicerelay.model.CommandStatus;
import io.devicerelay.model.DeviceRecord;
import io.devicerelay.observability.AuditLogger;
import io.devicerelay.security.DeviceTokens;
import io.devicerelay.storage.CommandStore;
import io.devicerelay.storage.DeviceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Device-side half of the relay: pairing, long-poll delivery, heartbeats, progress and
 * results. Every call except {@link #pair} starts from a device already resolved through
 * {@link #authenticate(String)}; ownership of a command is checked against that device in the
 * store, never in memory.
 */
public final class DeliveryProtocol {
    private static final Logger log = LoggerFactory.getLogger(DeliveryProtocol.class);

    private final CommandStore commandStore;
    private final DeviceStore deviceStore;
    private final DeviceTokens tokens;
    private final AuditLogger audit;
    private final RelaySettings settings;
    private final Clock clock;

    public DeliveryProtocol(CommandStore commandStore, DeviceStore deviceStore, DeviceTokens tokens, AuditLogger audit,
                            RelaySettings settings, Clock clock) {
        this.commandStore = commandStore;
        this.deviceStore = deviceStore;
        this.tokens = tokens;
        this.audit = audit;
        this.settings = settings;
        this.clock = clock;
    }

    public Optional<DeviceRecord> authenticate(String bearerToken) {
        if (bearerToken == null || bearerToken.isBlank()) {
            return Optional.empty();
        }
        return deviceStore.findByTokenHash(DeviceTokens.hash(bearerToken));
    }

    public PairResponse pair(String code, DeviceStore.DeviceRegistration registration) {
        String token = tokens.newToken();
        DeviceStore.PairingOutcome outcome = deviceStore.completePairing(
                code, registration, DeviceTokens.hash(token), settings.maxDevicesPerUser(), clock.millis());
        if (!outcome.success()) {
            log.info("Pairing refused: {}", outcome.error());
            return new PairResponse(false, null, null, outcome.error());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("deviceName", registration.deviceName());
        details.put("deviceType", registration.deviceType());
        audit.log(AuditLogger.AuditEvent.device("device.pair", outcome.userId(), outcome.deviceId(), null, "ok", details));
        log.info("Paired device {} for user {}", outcome.deviceId(), outcome.userId());
        return new PairResponse(true, token, outcome.deviceId(), null);
    }

    /**
     * Claims the device's deliverable commands, waiting up to {@code longPollTimeoutMs} for
     * one to appear. Claims are committed before this returns, so a dropped response loses
     * nothing but the delivery itself. An interrupt ends the wait with an empty list.
     */
    public List<ClaimedCommand> poll(DeviceRecord device) {
        deviceStore.markSeen(device.deviceId(), clock.millis());
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(settings.longPollTimeoutMs());
        while (true) {
            List<ClaimedCommand> claimed = commandStore.claim(device.deviceId(), settings.claimLimit(), clock.millis());
            if (!claimed.isEmpty()) {
                log.debug("Delivered {} command(s) to device {}", claimed.size(), device.deviceId());
                return claimed;
            }
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) {
                return List.of();
            }
            try {
                Thread.sleep(Math.min(settings.pollIntervalMs(), remainingMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return List.of();
            }
        }
    }

    public int heartbeat(DeviceRecord device) {
        long now = clock.millis();
        deviceStore.markSeen(device.deviceId(), now);
        return commandStore.countClaimable(device.deviceId(), now);
    }

    public boolean progress(DeviceRecord device, String commandId, String event, String message, String data) {
        return commandStore.appendProgress(commandId, device.deviceId(), event, message, data, clock.millis());
    }

    public boolean submitResult(DeviceRecord device, String commandId, String encryptedResult, String resultIv,
                                String resultAuthTag, String resultSummary, String status) {
        CommandStatus outcome = CommandStatus.fromDeviceOutcome(status);
        boolean stored = commandStore.submitResult(commandId, device.deviceId(),
                new CommandStore.ResultSubmission(
                        blankToNull(encryptedResult),
                        blankToNull(resultIv),
                        blankToNull(resultAuthTag),
                        blankToNull(resultSummary),
                        outcome),
                clock.millis());
        if (stored) {
            audit.log(AuditLogger.AuditEvent.device("command.result", device.userId(), device.deviceId(), commandId,
                    outcome.wireName(), Map.of()));
        }
        return stored;
    }

    public List<DeviceRecord> devices(DeviceRecord device) {
        return deviceStore.listDevices(device.userId());
    }

    /**
     * Removes a device of {@code userId} and cancels every unfinished command addressed to it.
     * The device is removed first so it can no longer claim while its queue is cancelled.
     */
    public boolean removeDevice(String userId, String deviceName) {
        Optional<DeviceRecord> target = deviceStore.findByName(userId, deviceName);
        if (target.isEmpty()) {
            return false;
        }
        DeviceRecord device = target.get();
        if (!deviceStore.remove(userId, device.deviceId())) {
            return false;
        }
        int cancelled = commandStore.cancelForDevice(device.deviceId(), clock.millis());
        audit.log(AuditLogger.AuditEvent.device("device.remove", userId, device.deviceId(), null, "ok",
                Map.of("deviceName", device.deviceName(), "cancelledCommands", cancelled)));
        log.info("Removed device {} of user {}, cancelled {} command(s)", device.deviceId(), userId, cancelled);
        return true;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public record PairResponse(boolean success, String deviceToken, String deviceId, String error) {
    }
}
