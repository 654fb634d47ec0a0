package io.devicerelay.runtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.devicerelay.billing.CreditLedger;
import io.devicerelay.billing.RelayBilling;
import io.devicerelay.billing.SqliteCreditLedger;
import io.devicerelay.billing.UsageStats;
import io.devicerelay.config.DeviceRelayConfig;
import io.devicerelay.config.RelaySettings;
import io.devicerelay.model.CommandPayload;
import io.devicerelay.model.CommandRecord;
import io.devicerelay.model.CommandStatus;
import io.devicerelay.model.DeviceRecord;
import io.devicerelay.model.ExecutionLogEntry;
import io.devicerelay.model.RiskLevel;
import io.devicerelay.observability.AuditLogger;
import io.devicerelay.safety.CommandParser;
import io.devicerelay.safety.SafetyClassifier;
import io.devicerelay.safety.SafetyVerdict;
import io.devicerelay.security.DeviceTokens;
import io.devicerelay.security.EncryptedBlob;
import io.devicerelay.security.PayloadCodec;
import io.devicerelay.storage.CommandStore;
import io.devicerelay.storage.Database;
import io.devicerelay.storage.DeviceStore;
import io.devicerelay.storage.RelayStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public final class DeviceRelayRuntime {
    private static final Logger log = LoggerFactory.getLogger(DeviceRelayRuntime.class);
    private static final int PREVIEW_LENGTH = 200;

    private final DeviceRelayConfig config;
    private final RelaySettings settings;
    private final Clock clock;
    private final Database database;
    private final CommandStore commandStore;
    private final DeviceStore deviceStore;
    private final RelayBilling billing;
    private final PayloadCodec codec;
    private final CommandParser parser;
    private final SafetyClassifier classifier;
    private final DeviceTokens tokens;
    private final AuditLogger auditLogger;
    private final DeliveryProtocol delivery;

    public DeviceRelayRuntime(DeviceRelayConfig config, RelaySettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.database = new Database(config);
        this.commandStore = new CommandStore(database);
        this.deviceStore = new DeviceStore(database);
        CreditLedger ledger = new SqliteCreditLedger(database);
        this.billing = new RelayBilling(ledger, settings.commandCost(), settings.freeCommandsPerDay(),
                settings.maxPendingCommands());
        this.codec = new PayloadCodec(settings.encryptionSecret());
        this.parser = new CommandParser();
        this.classifier = new SafetyClassifier(settings.workspaceRoots());
        this.tokens = new DeviceTokens(settings.encryptionSecret());
        this.auditLogger = new AuditLogger(config.auditFile(), settings.auditSigningSecret(), clock);
        this.delivery = new DeliveryProtocol(commandStore, deviceStore, tokens, auditLogger, settings, clock);
    }

    /** Loads settings from the data root and initializes the store. */
    public static DeviceRelayRuntime open(DeviceRelayConfig config) {
        DeviceRelayRuntime runtime = new DeviceRelayRuntime(config, RelaySettings.load(config), Clock.systemUTC());
        runtime.init();
        return runtime;
    }

    public void init() {
        database.init();
        log.info("Device relay ready at {} ({})", config.rootDir(), settings);
    }

    public DeliveryProtocol delivery() {
        return delivery;
    }

    public RelaySettings settings() {
        return settings;
    }

    public PayloadCodec codec() {
        return codec;
    }

    public SendOutcome send(String userId, String targetDeviceName, String commandText) {
        return send(userId, targetDeviceName, commandText, 0);
    }

    /**
     * Parses, grades, charges and queues one command. Blocked commands, unknown or offline
     * targets and full queues are refused before anything is charged or stored. A command that
     * cannot be stored after its charge is credited back.
     */
    public SendOutcome send(String userId, String targetDeviceName, String commandText, int priority) {
        requireUser(userId);
        if (commandText == null || commandText.isBlank()) {
            throw new IllegalArgumentException("command text must not be blank");
        }
        if (targetDeviceName == null || targetDeviceName.isBlank()) {
            throw new IllegalArgumentException("target device name must not be blank");
        }
        CommandPayload payload = parser.parse(commandText);
        SafetyVerdict verdict = classifier.classify(payload);
        if (verdict.blocked()) {
            log.warn("Blocked command for user {}: {}", userId, verdict.explanation());
            auditLogger.log(AuditLogger.AuditEvent.operator("command.send", userId, null, "blocked",
                    Map.of("type", payload.type().wireName(), "reason", verdict.explanation())));
            return SendOutcome.blocked(verdict, StatusFormatter.blocked(verdict));
        }

        long now = clock.millis();
        String commandId = UUID.randomUUID().toString();
        RelayBilling.Charge charge = null;
        boolean queued;
        DeviceRecord target;
        CommandStatus initial = verdict.requiresConfirmation()
                ? CommandStatus.AWAITING_CONFIRMATION
                : CommandStatus.PENDING;
        try {
            Optional<DeviceRecord> device = deviceStore.findByName(userId, targetDeviceName);
            if (device.isEmpty()) {
                return SendOutcome.failed("device_not_found", StatusFormatter.deviceNotFound(targetDeviceName.trim()));
            }
            target = device.get();
            if (!target.online()) {
                return SendOutcome.failed("device_offline", StatusFormatter.deviceOffline(target.deviceName()));
            }
            if (billing.atPendingLimit(commandStore.countUnfinished(userId, now))) {
                return SendOutcome.failed("too_many_pending", StatusFormatter.pendingLimit(billing.maxPendingCommands()));
            }
            RelayBilling.Charge attempt = billing.charge(userId, commandId, now);
            if (!attempt.accepted()) {
                return SendOutcome.failed("insufficient_credits", StatusFormatter.insufficientCredits(attempt.credits()));
            }
            charge = attempt;
            EncryptedBlob blob = codec.encryptJson(payload);
            queued = commandStore.insertWithinLimit(new CommandStore.NewCommand(
                    commandId,
                    userId,
                    target.deviceId(),
                    target.deviceName(),
                    blob,
                    initial,
                    priority,
                    verdict.riskLevel(),
                    verdict.warnings(),
                    preview(payload.command()),
                    charge.credits(),
                    now,
                    now + settings.commandTtlMs()
            ), billing.maxPendingCommands());
        } catch (RelayStoreException | IllegalStateException e) {
            log.error("Failed to queue command {} for user {}", commandId, userId, e);
            if (charge != null) {
                billing.compensate(userId, commandId, charge.credits(), clock.millis());
            }
            return SendOutcome.failed("store_unavailable", StatusFormatter.tryAgain());
        }
        if (!queued) {
            // Another send took the last slot between the pre-check and the insert.
            billing.compensate(userId, commandId, charge.credits(), clock.millis());
            return SendOutcome.failed("too_many_pending", StatusFormatter.pendingLimit(billing.maxPendingCommands()));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", payload.type().wireName());
        details.put("device", target.deviceName());
        details.put("risk", verdict.riskLevel().wireName());
        details.put("credits", charge.credits());
        auditLogger.log(AuditLogger.AuditEvent.operator("command.send", userId, commandId, initial.wireName(), details));
        String message = verdict.requiresConfirmation()
                ? StatusFormatter.confirmationRequired(commandId, target.deviceName(), verdict, charge.credits())
                : StatusFormatter.queued(commandId, target.deviceName(), charge.credits());
        return SendOutcome.queued(commandId, initial, verdict, charge.credits(), message);
    }

    public ActionOutcome confirm(String idOrPrefix, String userId) {
        requireUser(userId);
        Optional<String> resolved = commandStore.resolveId(userId, idOrPrefix);
        if (resolved.isEmpty()) {
            return ActionOutcome.notFound(idOrPrefix);
        }
        String commandId = resolved.get();
        long now = clock.millis();
        if (!commandStore.confirm(commandId, userId, now)) {
            return notActionable(commandId, userId, now);
        }
        auditLogger.log(AuditLogger.AuditEvent.operator("command.confirm", userId, commandId, "ok", Map.of()));
        return new ActionOutcome(true, commandId, CommandStatus.PENDING, 0, StatusFormatter.confirmed(commandId));
    }

    /**
     * Rejects a command awaiting confirmation and refunds its charge. Only the call that wins
     * the transition refunds; a repeated or late reject refunds nothing.
     */
    public ActionOutcome reject(String idOrPrefix, String userId) {
        requireUser(userId);
        Optional<String> resolved = commandStore.resolveId(userId, idOrPrefix);
        if (resolved.isEmpty()) {
            return ActionOutcome.notFound(idOrPrefix);
        }
        String commandId = resolved.get();
        long now = clock.millis();
        Optional<CommandStore.Rejection> rejection = commandStore.reject(commandId, userId, now);
        if (rejection.isEmpty()) {
            return notActionable(commandId, userId, now);
        }
        int refunded = billing.refund(userId, commandId, rejection.get().creditsCharged(), now);
        auditLogger.log(AuditLogger.AuditEvent.operator("command.reject", userId, commandId, "ok",
                Map.of("refundedCredits", refunded)));
        return new ActionOutcome(true, commandId, CommandStatus.CANCELLED, refunded,
                StatusFormatter.rejected(commandId, refunded));
    }

    public ActionOutcome cancel(String idOrPrefix, String userId) {
        requireUser(userId);
        Optional<String> resolved = commandStore.resolveId(userId, idOrPrefix);
        if (resolved.isEmpty()) {
            return ActionOutcome.notFound(idOrPrefix);
        }
        String commandId = resolved.get();
        long now = clock.millis();
        if (!commandStore.cancel(commandId, userId, now)) {
            return notActionable(commandId, userId, now);
        }
        auditLogger.log(AuditLogger.AuditEvent.operator("command.cancel", userId, commandId, "ok", Map.of()));
        return new ActionOutcome(true, commandId, CommandStatus.CANCELLED, 0, StatusFormatter.cancelled(commandId));
    }

    public Optional<ExecutionLogView> getExecutionLog(String idOrPrefix, String userId) {
        requireUser(userId);
        Optional<CommandRecord> record = commandStore.resolveId(userId, idOrPrefix)
                .flatMap(id -> commandStore.find(id, userId));
        if (record.isEmpty()) {
            return Optional.empty();
        }
        CommandRecord r = record.get();
        CommandStatus status = r.effectiveStatus(clock.millis());
        List<ExecutionLogEntry> entries = commandStore.executionLog(r.commandId());
        return Optional.of(new ExecutionLogView(r.commandId(), status, entries,
                StatusFormatter.executionLog(r.commandId(), status, entries)));
    }

    /**
     * Returns the command's status and, once the device has reported, its result. The
     * encrypted result is decrypted here; when it does not decrypt, only the summary is returned.
     */
    public Optional<CommandResultView> getCommandResult(String idOrPrefix, String userId) {
        requireUser(userId);
        Optional<CommandRecord> record = commandStore.resolveId(userId, idOrPrefix)
                .flatMap(id -> commandStore.find(id, userId));
        if (record.isEmpty()) {
            return Optional.empty();
        }
        CommandRecord r = record.get();
        String output = null;
        boolean decryptFailed = false;
        if (r.hasEncryptedResult()) {
            Optional<String> plain = codec.decrypt(r.encryptedResult(), r.resultIv(), r.resultAuthTag());
            if (plain.isPresent()) {
                output = plain.get();
            } else {
                decryptFailed = true;
                log.warn("Result of command {} did not decrypt", r.commandId());
            }
        }
        return Optional.of(new CommandResultView(
                r.commandId(),
                r.targetDeviceName(),
                r.effectiveStatus(clock.millis()),
                r.resultSummary(),
                output,
                decryptFailed,
                isoOrNull(r.completedAtMs())
        ));
    }

    public List<CommandSummary> getRecentCommands(String userId, int limit) {
        requireUser(userId);
        long now = clock.millis();
        List<CommandSummary> out = new ArrayList<>();
        for (CommandRecord r : commandStore.recent(userId, Math.max(1, Math.min(limit, 100)))) {
            out.add(new CommandSummary(
                    r.commandId(),
                    StatusFormatter.shortId(r.commandId()),
                    r.targetDeviceName(),
                    r.effectiveStatus(now),
                    r.riskLevel(),
                    r.safetyWarnings(),
                    r.commandPreview(),
                    r.creditsCharged(),
                    Instant.ofEpochMilli(r.createdAtMs()).toString(),
                    Instant.ofEpochMilli(r.expiresAtMs()).toString()
            ));
        }
        return out;
    }

    public DeviceStore.PairingCode createPairingCode(String userId) {
        requireUser(userId);
        DeviceStore.PairingCode code = deviceStore.issuePairingCode(
                userId, tokens::newPairingCode, settings.pairingCodeTtlMs(), clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.operator("device.pair_code", userId, null, "ok", Map.of()));
        return code;
    }

    public List<DeviceRecord> listDevices(String userId) {
        requireUser(userId);
        return deviceStore.listDevices(userId);
    }

    public boolean removeDevice(String userId, String deviceName) {
        requireUser(userId);
        return delivery.removeDevice(userId, deviceName);
    }

    public int grantCredits(String userId, int amount) {
        requireUser(userId);
        billing.grant(userId, amount, clock.millis());
        auditLogger.log(AuditLogger.AuditEvent.operator("credits.grant", userId, null, "ok", Map.of("credits", amount)));
        return billing.balance(userId);
    }

    public int balance(String userId) {
        requireUser(userId);
        return billing.balance(userId);
    }

    public UsageStats usageStats(String userId) {
        requireUser(userId);
        return billing.usageStats(userId, clock.millis());
    }

    /** Persists expiry of every overdue unfinished command and marks silent devices offline. */
    public MaintenanceOutcome runMaintenance() {
        long now = clock.millis();
        int expired = commandStore.expireOverdue(now);
        int offline = deviceStore.markOffline(now - settings.offlineAfterMs());
        if (expired > 0 || offline > 0) {
            log.info("Maintenance expired {} command(s), marked {} device(s) offline", expired, offline);
        }
        return new MaintenanceOutcome(expired, offline);
    }

    private ActionOutcome notActionable(String commandId, String userId, long now) {
        CommandStatus current = commandStore.find(commandId, userId)
                .map(r -> r.effectiveStatus(now))
                .orElse(null);
        if (current == null) {
            return ActionOutcome.notFound(commandId);
        }
        return new ActionOutcome(false, commandId, current, 0, StatusFormatter.notActionable(commandId, current));
    }

    private static void requireUser(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
    }

    private static String preview(String command) {
        String text = command == null ? "" : command;
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH);
    }

    private static String isoOrNull(Long epochMs) {
        return epochMs == null ? null : Instant.ofEpochMilli(epochMs).toString();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record SendOutcome(
            boolean success,
            String commandId,
            CommandStatus status,
            boolean confirmationRequired,
            boolean blocked,
            RiskLevel riskLevel,
            List<String> warnings,
            String safetyWarning,
            String error,
            String message,
            int creditsCharged
    ) {
        static SendOutcome queued(String commandId, CommandStatus status, SafetyVerdict verdict, int credits,
                                  String message) {
            return new SendOutcome(true, commandId, status, verdict.requiresConfirmation(), false,
                    verdict.riskLevel(), verdict.warnings(),
                    verdict.requiresConfirmation() ? message : null, null, message, credits);
        }

        static SendOutcome blocked(SafetyVerdict verdict, String message) {
            return new SendOutcome(false, null, null, false, true, verdict.riskLevel(), verdict.warnings(),
                    message, "blocked", message, 0);
        }

        static SendOutcome failed(String error, String message) {
            return new SendOutcome(false, null, null, false, false, null, List.of(), null, error, message, 0);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ActionOutcome(boolean success, String commandId, CommandStatus status, int refundedCredits,
                                String message) {
        static ActionOutcome notFound(String idOrPrefix) {
            return new ActionOutcome(false, null, null, 0, StatusFormatter.notFound(idOrPrefix));
        }
    }

    public record ExecutionLogView(String commandId, CommandStatus status, List<ExecutionLogEntry> entries,
                                   String text) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CommandResultView(
            String commandId,
            String deviceName,
            CommandStatus status,
            String resultSummary,
            String output,
            boolean decryptFailed,
            String completedAt
    ) {
    }

    public record CommandSummary(
            String commandId,
            String shortId,
            String deviceName,
            CommandStatus status,
            RiskLevel riskLevel,
            List<String> warnings,
            String preview,
            int creditsCharged,
            String createdAt,
            String expiresAt
    ) {
    }

    public record MaintenanceOutcome(int expiredCommands, int devicesMarkedOffline) {
    }
}
