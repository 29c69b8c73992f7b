package com.capitalallocator.ledger;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Ledger settings, prefix {@code allocator.ledger.*}.
 *
 * <ul>
 *   <li>reservationTtl: how long a proposal's cash stays reserved before it is released (15m)</li>
 *   <li>expirySweepIntervalMs: delay between expiry sweeps (30s)</li>
 * </ul>
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "allocator.ledger")
public class LedgerConfig {

    @NotNull
    private Duration reservationTtl = Duration.ofMinutes(15);

    @Min(1000)
    private long expirySweepIntervalMs = 30_000;
}
