package com.capitalallocator.domain.model;

import java.math.BigDecimal;

/**
 * A sized stage of a proposal. The first tranche is reserved immediately; later tranches hold
 * a planned quantity and are re-sized against the ledger when released.
 */
public record Tranche(int index, BigDecimal percent, int quantity, TrancheReleaseCondition releaseCondition) {

    public boolean isImmediate() {
        return releaseCondition == null || releaseCondition.delayDays() == 0;
    }
}
