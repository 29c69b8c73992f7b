package com.capitalallocator.domain.enums;

/**
 * The six pre-trade guardrails, in evaluation order.
 */
public enum GuardrailCheckType {
    LIQUIDITY,
    POSITION_SIZE,
    SECTOR_EXPOSURE,
    EVENT_WINDOW,
    REGIME,
    CATALYST_FRESHNESS
}
