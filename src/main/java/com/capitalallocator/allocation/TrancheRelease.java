package com.capitalallocator.allocation;

import com.capitalallocator.domain.enums.TrancheReleaseStatus;
import com.capitalallocator.domain.model.BlockRecord;
import com.capitalallocator.domain.model.GuardrailResult;
import com.capitalallocator.domain.model.TradeProposal;

/**
 * Result of {@link TrancheReleaseService#releaseNextTranche}. {@code proposal} is set only when
 * the status is RELEASED, {@code blockRecord} only when BLOCKED.
 */
public record TrancheRelease(
        TrancheReleaseStatus status,
        int trancheIndex,
        TradeProposal proposal,
        GuardrailResult guardrailResult,
        BlockRecord blockRecord) {

    static TrancheRelease of(TrancheReleaseStatus status, int trancheIndex) {
        return new TrancheRelease(status, trancheIndex, null, null, null);
    }
}
