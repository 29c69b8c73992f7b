package com.capitalallocator.account;

import com.capitalallocator.domain.enums.Objective;
import com.capitalallocator.domain.model.KillSwitch;
import com.capitalallocator.domain.model.Mandate;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything needed to set up an account. An empty {@code killSwitches} list gets the configured
 * default daily-loss and drawdown switches.
 */
@Getter
@Builder
public class OpenAccountRequest {

    /** Optional; a random id is assigned when null. */
    private final String accountId;

    private final String name;
    private final Objective objective;
    private final BigDecimal initialCapital;

    @Builder.Default
    private final BigDecimal emergencyBufferPercent = BigDecimal.ZERO;

    /** Initial mandate; its account id and version are assigned on open. */
    private final Mandate mandate;

    @Builder.Default
    private final List<KillSwitch> killSwitches = List.of();
}
