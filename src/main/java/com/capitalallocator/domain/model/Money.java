package com.capitalallocator.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency rounding shared by the ledger, the sizer and the guardrails: scale 2, HALF_UP.
 */
public final class Money {

    public static final int SCALE = 2;
    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;
    public static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {}

    public static BigDecimal of(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO.setScale(SCALE) : amount.setScale(SCALE, ROUNDING);
    }

    public static BigDecimal of(long amount) {
        return BigDecimal.valueOf(amount).setScale(SCALE);
    }

    /** {@code percent}% of {@code base}, e.g. percentOf(2, 100000) = 2000.00. */
    public static BigDecimal percentOf(BigDecimal percent, BigDecimal base) {
        return of(base.multiply(percent).divide(HUNDRED, 10, ROUNDING));
    }

    /** {@code price × quantity}, rounded to currency. */
    public static BigDecimal notional(BigDecimal price, int quantity) {
        return of(price.multiply(BigDecimal.valueOf(quantity)));
    }
}
