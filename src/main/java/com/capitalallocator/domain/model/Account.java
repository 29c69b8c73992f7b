package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.Objective;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An independent trading account and its capital buckets.
 *
 * <p>Cash fields are only mutated by {@link com.capitalallocator.ledger.CapitalLedger} under
 * the account's lock, and {@code paused} only by the kill switch monitor. Repositories hand out
 * copies, so an Account held by a caller is a point-in-time snapshot.
 *
 * <p>Invariant: {@code availableCash + reservedCash + deployedCash == totalCapital + realizedPnl},
 * and all three cash buckets are non-negative.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private String id;
    private String name;

    /** Contributed capital: deposits and SIP installments plus transfers in, minus transfers out. */
    @Builder.Default
    private BigDecimal totalCapital = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal availableCash = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal reservedCash = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal deployedCash = BigDecimal.ZERO;

    /** Net realized gains minus losses booked through position closes. */
    @Builder.Default
    private BigDecimal realizedPnl = BigDecimal.ZERO;

    private Objective objective;

    /** Set by the kill switch monitor; blocks new allocations until manual reset. */
    private boolean paused;

    @Builder.Default
    private boolean active = true;

    /** Share of available cash held back from sizing. Zero means the full balance is deployable. */
    @Builder.Default
    private BigDecimal emergencyBufferPercent = BigDecimal.ZERO;
}
