package com.capitalallocator.allocation;

import java.util.List;
import lombok.Getter;

/**
 * Result of {@link MandateFilter#evaluate}: eligible, or the list of rules the signal broke.
 */
@Getter
public class MandateCheck {

    public static final String HORIZON_OUT_OF_RANGE = "HORIZON_OUT_OF_RANGE";
    public static final String SECTOR_NOT_ALLOWED = "SECTOR_NOT_ALLOWED";
    public static final String STRATEGY_NOT_ALLOWED = "STRATEGY_NOT_ALLOWED";
    public static final String ACCOUNT_PAUSED = "ACCOUNT_PAUSED";

    private final List<String> reasons;

    MandateCheck(List<String> reasons) {
        this.reasons = List.copyOf(reasons);
    }

    public boolean isEligible() {
        return reasons.isEmpty();
    }

    public boolean isPaused() {
        return reasons.contains(ACCOUNT_PAUSED);
    }
}
