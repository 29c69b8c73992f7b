package com.capitalallocator.allocation;

import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.sizing.SizingParameters;

/**
 * A candidate with its objective score, boost included.
 */
public record RankedSignal(RankCandidate candidate, double score) {

    public Signal signal() {
        return candidate.signal();
    }

    public MarketSnapshot snapshot() {
        return candidate.snapshot();
    }

    public SizingParameters parameters() {
        return candidate.parameters();
    }
}
