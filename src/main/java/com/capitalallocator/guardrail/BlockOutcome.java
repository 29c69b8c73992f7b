package com.capitalallocator.guardrail;

import com.capitalallocator.domain.model.BlockRecord;

/**
 * Result of {@link BlockRecordService#openBlock}: the open block for the pair, and whether this
 * call created it.
 */
public record BlockOutcome(BlockRecord blockRecord, boolean created) {}
