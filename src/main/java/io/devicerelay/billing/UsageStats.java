package io.devicerelay.billing;

/**
 * Per-user relay usage. {@code totalCreditsUsed} is net of refunds and compensations.
 */
public record UsageStats(int totalCommands, int totalCreditsUsed, int commandsToday) {
}
