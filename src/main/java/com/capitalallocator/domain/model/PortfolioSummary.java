package com.capitalallocator.domain.model;

import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Aggregate cash position across all accounts.
 */
@Getter
@Builder
public class PortfolioSummary {

    private final int accountCount;
    private final BigDecimal totalCapital;
    private final BigDecimal availableCash;
    private final BigDecimal reservedCash;
    private final BigDecimal deployedCash;
    private final BigDecimal realizedPnl;
    private final List<LedgerBalance> accounts;

    /** Deployed cash as a percent of total capital; zero for an empty book. */
    private final BigDecimal deployedPercent;
}
