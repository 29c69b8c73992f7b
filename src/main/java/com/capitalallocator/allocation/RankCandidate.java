package com.capitalallocator.allocation;

import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.sizing.SizingParameters;

/**
 * An eligible signal with the market data and sizing parameters it will be sized with.
 */
public record RankCandidate(Signal signal, MarketSnapshot snapshot, SizingParameters parameters) {}
