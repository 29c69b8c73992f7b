package com.capitalallocator.allocation;

import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.domain.model.TradeProposal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * A proposal whose later tranches are still waiting to be released. Tranche delays count from
 * the first fill, so nothing is due until {@code firstFilledAt} is set.
 */
@Data
@Builder(toBuilder = true)
@AllArgsConstructor
public class StagedProposal {

    private TradeProposal proposal;
    private Signal signal;

    /** Index of the next tranche to release; starts at 1 since tranche 0 was reserved up front. */
    private int nextIndex;

    private LocalDateTime firstFilledAt;

    public boolean isComplete() {
        return nextIndex >= proposal.getTranches().size();
    }
}
