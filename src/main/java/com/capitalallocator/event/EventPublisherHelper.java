package com.capitalallocator.event;

import com.capitalallocator.domain.model.BlockRecord;
import com.capitalallocator.domain.model.CapitalTransaction;
import com.capitalallocator.domain.model.TradeProposal;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper around Spring's {@link ApplicationEventPublisher} with typed methods for the
 * allocator's events.
 *
 * <p>Delivery is synchronous unless a listener is annotated {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Allocation ----

    public void publishTradeProposal(Object source, TradeProposal proposal) {
        applicationEventPublisher.publishEvent(new TradeProposalEvent(source, proposal));
    }

    public void publishBlockRecord(Object source, BlockRecord blockRecord) {
        applicationEventPublisher.publishEvent(new BlockRecordEvent(source, blockRecord));
    }

    // ---- Ledger ----

    public void publishCapitalTransaction(Object source, CapitalTransaction transaction) {
        applicationEventPublisher.publishEvent(new CapitalTransactionEvent(source, transaction));
    }

    // ---- Risk ----

    public void publishRiskEvent(
            Object source, String accountId, RiskEventType type, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, accountId, type, level, message));
    }

    public void publishRiskEvent(
            Object source,
            String accountId,
            RiskEventType type,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, accountId, type, level, message, details));
    }
}
