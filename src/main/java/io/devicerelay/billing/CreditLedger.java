package io.devicerelay.billing;

/**
 * Account balances and the usage trail. Implementations must make each debit and credit a
 * single atomic change of the balance.
 */
public interface CreditLedger {
    /**
     * Prices and debits one command in a single transaction. The command is free while fewer
     * than {@code freePerDay} commands were charged since {@code freeSinceMs}, and costs
     * {@code cost} otherwise. A {@link UsageAction#COMMAND} row is recorded for every accepted
     * debit, free ones included.
     *
     * @return the debit; when it is not accepted nothing has changed
     */
    Debit debitCommand(String userId, String commandId, int cost, int freePerDay, long freeSinceMs, long nowMs);

    void credit(String userId, String commandId, int credits, UsageAction action, long nowMs);

    /** Adds credits outside any command, e.g. a top-up. Not recorded as usage. */
    void grant(String userId, int credits, long nowMs);

    int balance(String userId);

    UsageStats usageStats(String userId, long sinceMs);

    record Debit(boolean accepted, int credits) {
    }
}
