package com.capitalallocator.sizing;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Position sizing settings, prefix {@code allocator.position-sizing.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>kellyCap: 0.5 (half Kelly at most, so the risk budget binds for a confident signal)</li>
 *   <li>assumedVariance: 0.04</li>
 *   <li>defaultAtrPercent: 2.0 (ATR assumed when the snapshot has none)</li>
 *   <li>defaultStopLossAtrMultiple: 2.0, defaultTakeProfitAtrMultiple: 4.0</li>
 * </ul>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "allocator.position-sizing")
public class PositionSizingConfig {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private BigDecimal kellyCap = new BigDecimal("0.5");

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal assumedVariance = new BigDecimal("0.04");

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal defaultAtrPercent = new BigDecimal("2.0");

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal defaultStopLossAtrMultiple = new BigDecimal("2.0");

    @DecimalMin(value = "0.0", inclusive = false)
    private BigDecimal defaultTakeProfitAtrMultiple = new BigDecimal("4.0");
}
