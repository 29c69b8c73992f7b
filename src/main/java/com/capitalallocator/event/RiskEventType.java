package com.capitalallocator.event;

/**
 * Classifies the condition behind a {@link RiskEvent}.
 */
public enum RiskEventType {

    /** A daily-loss or drawdown kill switch breached its threshold and paused the account. */
    KILL_SWITCH_TRIPPED,

    /** An operator cleared the account's kill switches. */
    KILL_SWITCH_RESET,

    /** A pending reservation passed its TTL and its cash went back to available. */
    RESERVATION_EXPIRED,

    /** An account or mandate snapshot was malformed and the account was skipped. */
    ALLOCATION_CONFIGURATION_ERROR
}
