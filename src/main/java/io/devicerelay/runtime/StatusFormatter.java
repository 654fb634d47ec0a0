package io.devicerelay.runtime;

import io.devicerelay.model.CommandStatus;
import io.devicerelay.model.ExecutionLogEntry;
import io.devicerelay.safety.SafetyVerdict;

import java.time.Instant;
import java.util.List;

/**
 * Operator-facing text for the chat front-end. Commands are referred to by the first eight
 * characters of their id, which the operator can type back as a prefix.
 */
public final class StatusFormatter {
    static final int SHORT_ID_LENGTH = 8;

    private StatusFormatter() {
    }

    public static String shortId(String commandId) {
        if (commandId == null) {
            return "";
        }
        return commandId.length() <= SHORT_ID_LENGTH ? commandId : commandId.substring(0, SHORT_ID_LENGTH);
    }

    public static String label(CommandStatus status) {
        return switch (status) {
            case AWAITING_CONFIRMATION -> "waiting for confirmation";
            case PENDING -> "queued";
            case DELIVERED -> "delivered";
            case EXECUTING -> "running";
            case COMPLETED -> "completed";
            case FAILED -> "failed";
            case CANCELLED -> "cancelled";
            case EXPIRED -> "expired";
        };
    }

    public static String queued(String commandId, String deviceName, int credits) {
        return "Command " + shortId(commandId) + " queued for " + deviceName + creditsSuffix(credits) + ".";
    }

    public static String confirmationRequired(String commandId, String deviceName, SafetyVerdict verdict, int credits) {
        String id = shortId(commandId);
        StringBuilder out = new StringBuilder();
        out.append("Command ").append(id).append(" for ").append(deviceName)
                .append(" needs confirmation (risk: ").append(verdict.riskLevel().wireName()).append(")");
        for (String warning : verdict.warnings()) {
            out.append("\n - ").append(warning);
        }
        out.append("\nReply \"confirm ").append(id).append("\" to run it or \"reject ").append(id)
                .append("\" to cancel");
        if (credits > 0) {
            out.append(" and get ").append(credits).append(" credits back");
        }
        out.append(".");
        return out.toString();
    }

    public static String blocked(SafetyVerdict verdict) {
        return verdict.explanation() + ". The command was not queued and no credits were charged.";
    }

    public static String confirmed(String commandId) {
        return "Command " + shortId(commandId) + " confirmed and queued.";
    }

    public static String rejected(String commandId, int refunded) {
        String text = "Command " + shortId(commandId) + " rejected.";
        return refunded > 0 ? text + " " + refunded + " credits refunded." : text;
    }

    public static String cancelled(String commandId) {
        return "Command " + shortId(commandId) + " cancelled.";
    }

    public static String notActionable(String commandId, CommandStatus status) {
        return "Command " + shortId(commandId) + " is " + label(status) + " and cannot be changed.";
    }

    public static String notFound(String idOrPrefix) {
        return "No command matches \"" + (idOrPrefix == null ? "" : idOrPrefix.trim()) + "\".";
    }

    public static String deviceNotFound(String deviceName) {
        return "No paired device named \"" + deviceName + "\".";
    }

    public static String deviceOffline(String deviceName) {
        return "Device \"" + deviceName + "\" is offline. Start the relay client on it and try again; nothing was charged.";
    }

    public static String insufficientCredits(int cost) {
        return "Not enough credits: this command costs " + cost + ".";
    }

    public static String pendingLimit(int max) {
        return "You already have " + max + " unfinished commands. Wait for them to finish or cancel some.";
    }

    public static String tryAgain() {
        return "The relay could not store the command. No credits were charged; please try again.";
    }

    public static String executionLog(String commandId, CommandStatus status, List<ExecutionLogEntry> entries) {
        StringBuilder out = new StringBuilder();
        out.append("Command ").append(shortId(commandId)).append(" (").append(label(status)).append(")");
        for (ExecutionLogEntry e : entries) {
            out.append("\n").append(e.seq()).append(". ").append(Instant.ofEpochMilli(e.timestampMs()))
                    .append(" ").append(e.event());
            if (e.message() != null && !e.message().isBlank()) {
                out.append(": ").append(e.message());
            }
        }
        return out.toString();
    }

    private static String creditsSuffix(int credits) {
        return credits > 0 ? " (" + credits + " credits)" : "";
    }
}
