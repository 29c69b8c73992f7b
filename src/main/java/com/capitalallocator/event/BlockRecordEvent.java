package com.capitalallocator.event;

import com.capitalallocator.domain.model.BlockRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published once per newly opened block. Re-evaluating an already blocked pair does not
 * publish again.
 */
public class BlockRecordEvent extends ApplicationEvent {

    private final BlockRecord blockRecord;

    public BlockRecordEvent(Object source, BlockRecord blockRecord) {
        super(source);
        this.blockRecord = blockRecord;
    }

    public BlockRecord getBlockRecord() {
        return blockRecord;
    }
}
