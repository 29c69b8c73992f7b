package com.capitalallocator.domain.enums;

/**
 * Result of trying to release the next tranche of a staged proposal.
 */
public enum TrancheReleaseStatus {
    RELEASED,
    NOT_DUE,
    COMPLETE,
    PAUSED,
    NO_MARKET_DATA,
    ZERO_SIZE,
    INSUFFICIENT_FUNDS,
    BLOCKED
}
