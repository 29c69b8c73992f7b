package com.capitalallocator.allocation;

import com.capitalallocator.domain.enums.AllocationOutcome;
import com.capitalallocator.domain.model.BlockRecord;
import com.capitalallocator.domain.model.TradeProposal;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * All decisions from one allocation run, grouped by account in account id order.
 */
public record AllocationBatchResult(List<AllocationDecision> decisions) {

    public AllocationBatchResult {
        decisions = List.copyOf(decisions);
    }

    public List<TradeProposal> proposals() {
        return decisions.stream()
                .map(AllocationDecision::getProposal)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<BlockRecord> blocks() {
        return decisions.stream()
                .map(AllocationDecision::getBlockRecord)
                .filter(Objects::nonNull)
                .toList();
    }

    public List<AllocationDecision> forAccount(String accountId) {
        return decisions.stream().filter(d -> accountId.equals(d.getAccountId())).toList();
    }

    public Map<AllocationOutcome, Long> countByOutcome() {
        Map<AllocationOutcome, Long> counts = new EnumMap<>(AllocationOutcome.class);
        for (AllocationDecision decision : decisions) {
            counts.merge(decision.getOutcome(), 1L, Long::sum);
        }
        return counts;
    }
}
