package com.capitalallocator.domain.enums;

/**
 * Unit of a mandate's max position size: a currency amount or a percentage of the
 * account's total capital.
 */
public enum PositionSizeLimitType {
    AMOUNT,
    PERCENT_OF_CAPITAL
}
