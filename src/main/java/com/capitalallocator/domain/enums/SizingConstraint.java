package com.capitalallocator.domain.enums;

/**
 * The cap that determined the final quantity in a sizing calculation.
 */
public enum SizingConstraint {
    RISK_BUDGET,
    MAX_POSITION_SIZE,
    KELLY_CAP,
    AVAILABLE_CASH,
    INVALID_STOP_DISTANCE
}
