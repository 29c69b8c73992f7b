package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.Direction;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A sized, guardrail-checked trade for one account, backed by a pending reservation. Handed to
 * order placement; the reservation is deployed when the fill comes back.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class TradeProposal {

    private final String id;
    private final String accountId;
    private final String signalId;
    private final String symbol;
    private final String sector;
    private final Direction direction;

    /** Quantity of the immediate tranche. */
    private final int quantity;

    @Builder.Default
    private final List<Tranche> tranches = List.of();

    private final BigDecimal entryPrice;
    private final BigDecimal stopLoss;
    private final BigDecimal takeProfit;

    private final BigDecimal reservedAmount;
    private final String reservationId;
    private final BigDecimal riskAmount;

    private final GuardrailResult guardrailResult;
    private final double score;
    private final LocalDateTime createdAt;

    public boolean isStaged() {
        return tranches.size() > 1;
    }
}
