package com.capitalallocator.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", true),
    NOT_FOUND("NOT_FOUND", false),
    INSUFFICIENT_FUNDS("INSUFFICIENT_FUNDS", true),
    INVALID_CONFIGURATION("INVALID_CONFIGURATION", false),
    LEDGER_CONTRACT_VIOLATION("LEDGER_CONTRACT_VIOLATION", false),
    STALE_RESERVATION("STALE_RESERVATION", false),
    INTERNAL_ERROR("INTERNAL_ERROR", false);

    private final String code;

    /** Whether the caller may retry the same request later without human intervention. */
    private final boolean recoverable;
}
