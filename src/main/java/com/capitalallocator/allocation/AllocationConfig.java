package com.capitalallocator.allocation;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Allocation batch settings, prefix {@code allocator.allocation.*}.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "allocator.allocation")
public class AllocationConfig {

    /** Most proposals one account may receive from a single batch. */
    @Min(1)
    private int maxProposalsPerAccount = 5;

    /** How long {@link AllocationEngine#allocate} waits for all accounts to finish. */
    @Min(1)
    private long batchTimeoutSeconds = 30;
}
