package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.PositionSizeLimitType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Set;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * The trading rules of one account at one version.
 *
 * <p>Mandates are append-only: an edit creates a new version through
 * {@link com.capitalallocator.repository.MandateRepository#appendVersion}, and prior versions are
 * kept unchanged for audit. The current mandate is the highest version. Instances are immutable.
 *
 * <p>Null optional limits fall back to configured defaults (sector exposure, blackout days,
 * ATR multiples) or disable the rule (max position size, max open positions).
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Mandate {

    private final String accountId;
    private final int version;

    private final int minHorizonDays;
    private final int maxHorizonDays;

    /** Empty means any sector. */
    @Builder.Default
    private final Set<String> allowedSectors = Set.of();

    /** Empty means any strategy. */
    @Builder.Default
    private final Set<String> allowedStrategies = Set.of();

    private final BigDecimal maxPositionSize;

    @Builder.Default
    private final PositionSizeLimitType maxPositionSizeType = PositionSizeLimitType.PERCENT_OF_CAPITAL;

    private final BigDecimal maxRiskPerTradePercent;
    private final BigDecimal maxSectorExposurePercent;

    private final BigDecimal stopLossAtrMultiple;
    private final BigDecimal takeProfitAtrMultiple;

    private final Integer earningsBlackoutDays;
    private final Integer maxOpenPositions;

    private final LocalDateTime createdAt;

    public boolean isSectorUnrestricted() {
        return allowedSectors == null || allowedSectors.isEmpty();
    }

    public boolean isStrategyUnrestricted() {
        return allowedStrategies == null || allowedStrategies.isEmpty();
    }
}
