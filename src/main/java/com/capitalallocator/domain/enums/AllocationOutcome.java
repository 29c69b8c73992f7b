package com.capitalallocator.domain.enums;

/**
 * Result of evaluating one (signal, account) pair in an allocation run.
 */
public enum AllocationOutcome {

    /** Cash reserved and a trade proposal emitted. */
    PROPOSED,

    /** Rejected by the mandate filter (horizon, sector, strategy). */
    INELIGIBLE,

    /** Account is paused by a tripped kill switch. */
    PAUSED,

    /** No market snapshot available for the symbol. */
    NO_MARKET_DATA,

    /** Sizing produced zero quantity. */
    ZERO_SIZE,

    /** Per-run proposal cap or mandate max open positions reached. */
    CAPACITY_REACHED,

    /** Ledger refused the reservation. */
    INSUFFICIENT_FUNDS,

    /** Guardrails blocked the trade and a new block record was opened. */
    BLOCKED,

    /** Guardrails blocked the trade; an open block record already existed. */
    DUPLICATE_BLOCK,

    /** Account or mandate snapshot is malformed. */
    CONFIGURATION_ERROR
}
