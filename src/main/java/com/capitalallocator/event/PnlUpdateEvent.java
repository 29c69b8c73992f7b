package com.capitalallocator.event;

import com.capitalallocator.domain.model.PnlUpdate;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the P&L feed for every mark-to-market update. Consumed by the kill switch
 * monitor.
 */
public class PnlUpdateEvent extends ApplicationEvent {

    private final PnlUpdate update;

    public PnlUpdateEvent(Object source, PnlUpdate update) {
        super(source);
        this.update = update;
    }

    public PnlUpdate getUpdate() {
        return update;
    }
}
