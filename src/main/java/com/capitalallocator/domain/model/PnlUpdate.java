package com.capitalallocator.domain.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Mark-to-market update for one account from the P&L feed.
 *
 * <p>{@code realizedDailyPnl} is the cumulative realized P&L for {@code tradingDate};
 * {@code unrealizedPnl} is the current mark on open positions.
 */
@Getter
@ToString
@Builder
public class PnlUpdate {

    private final String accountId;
    private final LocalDate tradingDate;

    @Builder.Default
    private final BigDecimal realizedDailyPnl = BigDecimal.ZERO;

    @Builder.Default
    private final BigDecimal unrealizedPnl = BigDecimal.ZERO;

    private final LocalDateTime timestamp;
}
