package com.capitalallocator.support;

import com.capitalallocator.domain.enums.Direction;
import com.capitalallocator.domain.enums.Objective;
import com.capitalallocator.domain.enums.PositionSizeLimitType;
import com.capitalallocator.domain.enums.RegimeLevel;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.domain.model.Signal;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Set;

/**
 * Shared test data. The defaults describe one worked example: a 1,00,000 BALANCED account risking
 * 2% per trade, and a LONG RELIANCE signal at 2450 with ATR 50. With a 2 ATR stop that sizes to 20
 * shares (risk budget 2000 / stop distance 100).
 */
public final class Fixtures {

    public static final ZoneId ZONE = ZoneId.of("Asia/Kolkata");
    public static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 15, 10, 0);

    private Fixtures() {}

    public static Account.AccountBuilder account(String id) {
        return Account.builder()
                .id(id)
                .name("Account " + id)
                .objective(Objective.BALANCED)
                .totalCapital(new BigDecimal("100000.00"))
                .availableCash(new BigDecimal("100000.00"))
                .reservedCash(new BigDecimal("0.00"))
                .deployedCash(new BigDecimal("0.00"));
    }

    public static Mandate.MandateBuilder mandate(String accountId) {
        return Mandate.builder()
                .accountId(accountId)
                .version(1)
                .minHorizonDays(1)
                .maxHorizonDays(30)
                .allowedSectors(Set.of())
                .allowedStrategies(Set.of())
                .maxPositionSize(new BigDecimal("60"))
                .maxPositionSizeType(PositionSizeLimitType.PERCENT_OF_CAPITAL)
                .maxRiskPerTradePercent(new BigDecimal("2"))
                .maxSectorExposurePercent(new BigDecimal("60"))
                .stopLossAtrMultiple(new BigDecimal("2"))
                .takeProfitAtrMultiple(new BigDecimal("4"))
                .earningsBlackoutDays(2)
                .maxOpenPositions(10);
    }

    public static Signal.SignalBuilder signal(String id, String symbol) {
        return Signal.builder()
                .id(id)
                .symbol(symbol)
                .direction(Direction.LONG)
                .edgeEstimate(new BigDecimal("5"))
                .confidence(0.8)
                .horizonDays(10)
                .sector("ENERGY")
                .strategy("MOMENTUM");
    }

    public static MarketSnapshot.MarketSnapshotBuilder snapshot(String symbol) {
        return MarketSnapshot.builder()
                .symbol(symbol)
                .price(new BigDecimal("2450"))
                .atr(new BigDecimal("50"))
                .averageDailyValue20(new BigDecimal("10000000"))
                .volatilityRegime(RegimeLevel.MEDIUM)
                .liquidityRegime(RegimeLevel.MEDIUM)
                .asOf(NOW);
    }
}
