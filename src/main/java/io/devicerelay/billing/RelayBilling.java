package io.devicerelay.billing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Charges a command once when it is created and refunds it only when the operator rejects it.
 * Expiry, cancellation and failed execution keep the charge.
 */
public final class RelayBilling {
    private static final Logger log = LoggerFactory.getLogger(RelayBilling.class);

    private final CreditLedger ledger;
    private final int commandCost;
    private final int freeCommandsPerDay;
    private final int maxPendingCommands;

    public RelayBilling(CreditLedger ledger, int commandCost, int freeCommandsPerDay, int maxPendingCommands) {
        this.ledger = ledger;
        this.commandCost = Math.max(0, commandCost);
        this.freeCommandsPerDay = Math.max(0, freeCommandsPerDay);
        this.maxPendingCommands = Math.max(1, maxPendingCommands);
    }

    public boolean atPendingLimit(int unfinishedCommands) {
        return unfinishedCommands >= maxPendingCommands;
    }

    public int maxPendingCommands() {
        return maxPendingCommands;
    }

    /**
     * Prices a new command and debits it in one ledger transaction, so two concurrent sends
     * cannot both take the last free command of the day. The command must not be queued
     * unless the returned charge is {@link Charge#accepted()}.
     */
    public Charge charge(String userId, String commandId, long nowMs) {
        CreditLedger.Debit debit = ledger.debitCommand(userId, commandId, commandCost, freeCommandsPerDay,
                startOfDayUtc(nowMs), nowMs);
        if (!debit.accepted()) {
            log.info("Insufficient credits for user {} (cost {})", userId, debit.credits());
        }
        return new Charge(debit.accepted(), debit.credits());
    }

    public int refund(String userId, String commandId, int creditsCharged, long nowMs) {
        if (creditsCharged <= 0) {
            return 0;
        }
        ledger.credit(userId, commandId, creditsCharged, UsageAction.REFUND, nowMs);
        return creditsCharged;
    }

    /** Returns a charge whose command never made it into the queue. */
    public void compensate(String userId, String commandId, int creditsCharged, long nowMs) {
        if (creditsCharged > 0) {
            ledger.credit(userId, commandId, creditsCharged, UsageAction.COMPENSATION, nowMs);
        }
    }

    public UsageStats usageStats(String userId, long nowMs) {
        return ledger.usageStats(userId, startOfDayUtc(nowMs));
    }

    public int balance(String userId) {
        return ledger.balance(userId);
    }

    public void grant(String userId, int credits, long nowMs) {
        ledger.grant(userId, credits, nowMs);
    }

    static long startOfDayUtc(long nowMs) {
        return Instant.ofEpochMilli(nowMs).atZone(ZoneOffset.UTC).toLocalDate()
                .atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }

    public record Charge(boolean accepted, int credits) {
    }
}
