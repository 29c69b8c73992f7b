package com.capitalallocator.sizing;

import com.capitalallocator.domain.model.TrancheSpec;
import java.math.BigDecimal;
import java.util.List;

/**
 * Effective sizing parameters for one (signal, account) pair after mandate defaults and
 * playbook overrides are applied.
 *
 * @param priorityBoost product of all priority boosts; 1.0 when none
 * @param tranches      staging plan; a single 100% tranche when the signal is not split
 */
public record SizingParameters(
        BigDecimal stopAtrMultiple, BigDecimal takeProfitAtrMultiple, List<TrancheSpec> tranches, double priorityBoost) {

    public SizingParameters {
        tranches = List.copyOf(tranches);
    }

    public boolean isStaged() {
        return tranches.size() > 1;
    }
}
