package io.devicerelay.safety;

import io.devicerelay.model.RiskLevel;

import java.util.List;

/**
 * Outcome of classifying one command. A blocked verdict always reports {@link RiskLevel#HIGH}
 * and is never queued, so confirmation cannot apply to it.
 */
public record SafetyVerdict(
        boolean blocked,
        boolean requiresConfirmation,
        RiskLevel riskLevel,
        List<String> warnings,
        String explanation
) {
    public SafetyVerdict {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        explanation = explanation == null ? "" : explanation;
    }

    public static SafetyVerdict autoRun(RiskLevel riskLevel) {
        return new SafetyVerdict(false, false, riskLevel, List.of(), "");
    }

    public static SafetyVerdict confirm(RiskLevel riskLevel, List<String> warnings, String explanation) {
        return new SafetyVerdict(false, true, riskLevel, warnings, explanation);
    }

    public static SafetyVerdict block(String reason) {
        return new SafetyVerdict(true, false, RiskLevel.HIGH, List.of(reason), "Blocked: " + reason);
    }
}
