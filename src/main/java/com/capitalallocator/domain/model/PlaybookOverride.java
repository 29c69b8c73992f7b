package com.capitalallocator.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Event playbook adjustment attached to a signal.
 *
 * <p>Overrides are data, not behaviour: {@link com.capitalallocator.allocation.PlaybookOverrideApplier}
 * folds them into the effective sizing parameters before the position sizer runs.
 */
public sealed interface PlaybookOverride {

    /** Multiplies the objective score. Values above 1 move the signal up the ranking. */
    record PriorityBoost(double factor) implements PlaybookOverride {

        public PriorityBoost {
            if (factor <= 0) {
                throw new IllegalArgumentException("Priority boost must be positive: " + factor);
            }
        }
    }

    /** Replaces the mandate's ATR multiples for stop loss and take profit. */
    record StopTargetOverride(BigDecimal stopAtrMultiple, BigDecimal takeProfitAtrMultiple)
            implements PlaybookOverride {

        public StopTargetOverride {
            if (stopAtrMultiple != null && stopAtrMultiple.signum() <= 0) {
                throw new IllegalArgumentException("Stop ATR multiple must be positive: " + stopAtrMultiple);
            }
            if (takeProfitAtrMultiple != null && takeProfitAtrMultiple.signum() <= 0) {
                throw new IllegalArgumentException("Target ATR multiple must be positive: " + takeProfitAtrMultiple);
            }
        }
    }

    /** Stages the position into tranches. Percentages must add up to 100. */
    record TrancheSplit(List<TrancheSpec> tranches) implements PlaybookOverride {

        public TrancheSplit {
            if (tranches == null || tranches.isEmpty()) {
                throw new IllegalArgumentException("Tranche split needs at least one tranche");
            }
            BigDecimal total = tranches.stream().map(TrancheSpec::percent).reduce(BigDecimal.ZERO, BigDecimal::add);
            if (total.compareTo(BigDecimal.valueOf(100)) != 0) {
                throw new IllegalArgumentException("Tranche percentages must add up to 100, got " + total);
            }
            tranches = List.copyOf(tranches);
        }
    }
}
