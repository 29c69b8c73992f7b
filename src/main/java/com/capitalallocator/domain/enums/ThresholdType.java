package com.capitalallocator.domain.enums;

/**
 * How a kill switch threshold is expressed. Thresholds are signed loss floors in both
 * cases: -5000 (ABSOLUTE) or -5.0 (PERCENT_OF_CAPITAL, i.e. -5% of total capital).
 */
public enum ThresholdType {
    ABSOLUTE,
    PERCENT_OF_CAPITAL
}
