package com.capitalallocator.allocation;

import com.capitalallocator.domain.enums.AllocationOutcome;
import com.capitalallocator.domain.model.BlockRecord;
import com.capitalallocator.domain.model.GuardrailResult;
import com.capitalallocator.domain.model.TradeProposal;
import com.capitalallocator.sizing.SizingResult;
import java.util.List;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * What happened to one (signal, account) pair in an allocation run. Which optional fields are
 * set depends on how far the pair got: a PROPOSED decision carries the proposal, a BLOCKED one
 * the block record and guardrail result.
 */
@Getter
@ToString
@Builder
public class AllocationDecision {

    private final String accountId;
    private final String signalId;
    private final String symbol;
    private final AllocationOutcome outcome;

    private final double score;
    private final SizingResult sizing;
    private final GuardrailResult guardrailResult;
    private final TradeProposal proposal;
    private final BlockRecord blockRecord;

    @Builder.Default
    private final List<String> reasons = List.of();

    public boolean isProposed() {
        return outcome == AllocationOutcome.PROPOSED;
    }
}
