package com.capitalallocator.event;

import com.capitalallocator.domain.model.CapitalTransaction;
import org.springframework.context.ApplicationEvent;

/**
 * Published after every ledger entry is appended.
 */
public class CapitalTransactionEvent extends ApplicationEvent {

    private final CapitalTransaction transaction;

    public CapitalTransactionEvent(Object source, CapitalTransaction transaction) {
        super(source);
        this.transaction = transaction;
    }

    public CapitalTransaction getTransaction() {
        return transaction;
    }
}
