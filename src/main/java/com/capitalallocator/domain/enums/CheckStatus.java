package com.capitalallocator.domain.enums;

/**
 * Outcome of a single guardrail check. Only CRITICAL blocks a reservation
 * (unless warning blocking is switched on in configuration).
 */
public enum CheckStatus {
    PASS,
    WARNING,
    CRITICAL
}
