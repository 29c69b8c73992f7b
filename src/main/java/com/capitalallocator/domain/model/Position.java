package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.Direction;
import com.capitalallocator.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A position owned by exactly one account. Opened from a deployed reservation and closed by
 * returning its cost basis to the ledger.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Position {

    private String id;
    private String accountId;
    private String symbol;
    private String sector;
    private Direction direction;

    /** Always positive; the side is carried by {@link #direction}. */
    private int quantity;

    private BigDecimal entryPrice;
    private BigDecimal stopLoss;
    private BigDecimal takeProfit;

    @Builder.Default
    private PositionStatus status = PositionStatus.OPEN;

    /** Set on close. */
    private BigDecimal realizedPnl;

    private BigDecimal exitPrice;
    private String reservationId;
    private LocalDateTime openedAt;
    private LocalDateTime closedAt;

    /** Cost basis at entry price. */
    public BigDecimal getNotional() {
        if (entryPrice == null) {
            return BigDecimal.ZERO;
        }
        return entryPrice.multiply(BigDecimal.valueOf(quantity));
    }

    public boolean isOpen() {
        return status == PositionStatus.OPEN;
    }
}
