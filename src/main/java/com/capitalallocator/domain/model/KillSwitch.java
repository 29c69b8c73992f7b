package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.KillSwitchKind;
import com.capitalallocator.domain.enums.ThresholdType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-account loss limit. Created with the account and evaluated on every P&L update.
 * Once tripped it stays tripped until a manual reset.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class KillSwitch {

    private String id;
    private String accountId;
    private KillSwitchKind kind;

    /** Signed loss floor: trips when the monitored metric is at or below it. */
    private BigDecimal threshold;

    @Builder.Default
    private ThresholdType thresholdType = ThresholdType.ABSOLUTE;

    private boolean tripped;
    private LocalDateTime trippedAt;
    private BigDecimal trippedValue;
}
