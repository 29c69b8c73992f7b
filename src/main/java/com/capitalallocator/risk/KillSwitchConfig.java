package com.capitalallocator.risk;

import jakarta.validation.constraints.DecimalMax;
import java.math.BigDecimal;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Default kill switches created with each account, prefix {@code allocator.kill-switch.*}.
 * Thresholds are signed loss floors as a percent of total capital.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "allocator.kill-switch")
public class KillSwitchConfig {

    @DecimalMax(value = "0.0", inclusive = false)
    private BigDecimal defaultDailyLossPercent = new BigDecimal("-5.0");

    @DecimalMax(value = "0.0", inclusive = false)
    private BigDecimal defaultDrawdownPercent = new BigDecimal("-15.0");
}
