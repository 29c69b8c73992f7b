package com.capitalallocator.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>CRITICAL is reserved for conditions that already triggered a protective action, such as
 * a kill switch pausing an account.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
