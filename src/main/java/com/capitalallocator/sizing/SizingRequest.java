package com.capitalallocator.sizing;

import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.Signal;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Inputs for one sizing decision. {@code atr} may be null.
 */
@Getter
@Builder
public class SizingRequest {

    private final Signal signal;
    private final Account account;
    private final Mandate mandate;
    private final BigDecimal entryPrice;
    private final BigDecimal atr;

    /** Ledger available cash less the emergency buffer, read under the account lock. */
    private final BigDecimal deployableCash;

    private final SizingParameters parameters;
}
