package com.capitalallocator.guardrail;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Guardrail thresholds, prefix {@code allocator.guardrails.*}.
 *
 * <p>Defaults:
 * <ul>
 *   <li>maxTradeToAdvRatio: 0.05 (a trade may be at most 5% of 20-day average daily value)</li>
 *   <li>eventBlackoutDays: 2, used when the mandate sets none</li>
 *   <li>defaultSectorExposurePercent: 30, used when the mandate sets none</li>
 *   <li>catalystFreshnessHours: 24</li>
 *   <li>blockOnWarning: false (WARNING outcomes are surfaced, not blocking)</li>
 * </ul>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "allocator.guardrails")
public class GuardrailConfig {

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal maxTradeToAdvRatio = new BigDecimal("0.05");

    @Min(1)
    private int advLookbackDays = 20;

    @Min(0)
    private int eventBlackoutDays = 2;

    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private BigDecimal defaultSectorExposurePercent = new BigDecimal("30");

    @Min(1)
    private long catalystFreshnessHours = 24;

    private boolean blockOnWarning = false;
}
