package com.capitalallocator.domain.model;

import java.math.BigDecimal;

/**
 * One stage of a playbook tranche split: the share of the planned quantity and the number of
 * days after the first fill at which it may be released.
 */
public record TrancheSpec(BigDecimal percent, int delayDays) {

    public TrancheSpec {
        if (percent == null || percent.signum() <= 0 || percent.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalArgumentException("Tranche percent must be in (0, 100]: " + percent);
        }
        if (delayDays < 0) {
            throw new IllegalArgumentException("Tranche delay must be non-negative: " + delayDays);
        }
    }
}
