package com.capitalallocator.guardrail;

import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.Position;
import com.capitalallocator.domain.model.Reservation;
import com.capitalallocator.domain.model.Signal;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything a guardrail check may look at for one proposed trade. Built under the account lock,
 * so the open positions and pending reservations are a consistent snapshot.
 */
@Getter
@Builder
public class GuardrailContext {

    private final Signal signal;
    private final Account account;
    private final Mandate mandate;
    private final MarketSnapshot snapshot;

    private final int quantity;
    private final BigDecimal entryPrice;
    private final BigDecimal stopLoss;

    @Builder.Default
    private final List<Position> openPositions = List.of();

    @Builder.Default
    private final List<Reservation> pendingReservations = List.of();

    private final LocalDateTime evaluatedAt;

    /** quantity × entry price. */
    public BigDecimal getNotional() {
        return Money.notional(entryPrice, quantity);
    }
}
