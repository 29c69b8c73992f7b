package com.capitalallocator.domain.enums;

/**
 * Severity of a guardrail warning. INFO entries are informational and never
 * affect {@code passedAll}.
 */
public enum GuardrailSeverity {
    INFO,
    WARNING,
    CRITICAL
}
