package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.GuardrailSeverity;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * A structured finding from a guardrail check: severity, a machine-readable code such as
 * {@code LIQUIDITY_BELOW_THRESHOLD}, a human-readable message, and check-specific details.
 */
@Getter
@Builder
public class GuardrailWarning {

    private final GuardrailSeverity severity;
    private final String code;
    private final String message;

    @Builder.Default
    private final Map<String, Object> details = Map.of();

    public static GuardrailWarning of(GuardrailSeverity severity, String code, String message) {
        return GuardrailWarning.builder().severity(severity).code(code).message(message).build();
    }

    public static GuardrailWarning of(
            GuardrailSeverity severity, String code, String message, Map<String, Object> details) {
        return GuardrailWarning.builder()
                .severity(severity)
                .code(code)
                .message(message)
                .details(details)
                .build();
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + message;
    }
}
