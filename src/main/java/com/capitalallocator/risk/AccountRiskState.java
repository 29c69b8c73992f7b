package com.capitalallocator.risk;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Running P&L picture of one account, as of the last P&L update.
 *
 * @param capitalBase contributed capital when the state was taken; peak equity follows changes to it
 * @param drawdown equity minus peak equity; zero or negative
 */
public record AccountRiskState(
        String accountId,
        LocalDate tradingDate,
        BigDecimal dailyRealizedPnl,
        BigDecimal unrealizedPnl,
        BigDecimal equity,
        BigDecimal capitalBase,
        BigDecimal peakEquity,
        BigDecimal drawdown) {}
