package com.capitalallocator.event;

import com.capitalallocator.domain.model.TradeProposal;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a signal passes every guardrail for an account and its cash is reserved.
 * Order placement picks the proposal up from here.
 */
public class TradeProposalEvent extends ApplicationEvent {

    private final TradeProposal proposal;

    public TradeProposalEvent(Object source, TradeProposal proposal) {
        super(source);
        this.proposal = proposal;
    }

    public TradeProposal getProposal() {
        return proposal;
    }
}
