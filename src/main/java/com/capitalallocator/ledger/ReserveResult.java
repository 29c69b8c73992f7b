package com.capitalallocator.ledger;

/**
 * Outcome of {@link CapitalLedger#reserve}. Insufficient funds is an expected result under
 * normal operation, so it is a value rather than an exception.
 */
public enum ReserveResult {
    OK,
    INSUFFICIENT_FUNDS;

    public boolean isOk() {
        return this == OK;
    }
}
