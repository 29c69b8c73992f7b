package com.capitalallocator.sizing;

import com.capitalallocator.domain.enums.SizingConstraint;
import com.capitalallocator.domain.model.Tranche;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Output of {@link PositionSizer#size}.
 *
 * <p>{@code quantity} is what can be reserved now (the first tranche, capped by cash).
 * {@code plannedQuantity} is the full position before the cash cap, split across
 * {@code tranches}. A zero quantity means no size fits; it is not an error.
 */
@Getter
@ToString
@Builder
public class SizingResult {

    private final int quantity;
    private final int plannedQuantity;

    @Builder.Default
    private final List<Tranche> tranches = List.of();

    private final BigDecimal entryPrice;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;
    private final BigDecimal stopDistance;

    /** quantity × stop distance. */
    private final BigDecimal riskAmount;

    /** quantity × entry price; the amount to reserve. */
    private final BigDecimal notional;

    private final SizingConstraint bindingConstraint;

    public boolean isZero() {
        return quantity <= 0;
    }
}
