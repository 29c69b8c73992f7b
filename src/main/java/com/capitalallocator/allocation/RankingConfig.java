package com.capitalallocator.allocation;

import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Objective ranking settings, prefix {@code allocator.ranking.*}.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "allocator.ranking")
public class RankingConfig {

    /** Volatility (ATR as % of price) assumed when a snapshot has no ATR. */
    @PositiveOrZero
    private double defaultVolatilityPercent = 2.0;

    /** Volatility penalty weight for MAX_PROFIT. RISK_MINIMIZED always uses a full penalty. */
    @PositiveOrZero
    private double maxProfitVolatilityPenalty = 0.25;
}
