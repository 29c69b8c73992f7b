package com.capitalallocator.guardrail;

import com.capitalallocator.domain.enums.BlockStatus;
import com.capitalallocator.domain.model.BlockRecord;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.exception.BusinessException;
import com.capitalallocator.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps at most one OPEN block per (signal, account) pair.
 *
 * <p>{@link #openBlock} looks up and creates in one atomic map operation, so concurrent or
 * repeated evaluations of the same blocked pair share one record and publish one event.
 * Resolving a block frees the pair to be blocked again.
 */
@Service
public class BlockRecordService {

    private static final Logger log = LoggerFactory.getLogger(BlockRecordService.class);

    private final Map<String, BlockRecord> openByPair = new ConcurrentHashMap<>();
    private final Map<String, BlockRecord> byId = new ConcurrentHashMap<>();
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public BlockRecordService(EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public BlockOutcome openBlock(String signalId, String accountId, String symbol, List<String> reasonCodes) {
        AtomicBoolean created = new AtomicBoolean(false);
        BlockRecord record = openByPair.computeIfAbsent(pairKey(signalId, accountId), key -> {
            created.set(true);
            BlockRecord fresh = BlockRecord.builder()
                    .id(UUID.randomUUID().toString())
                    .accountId(accountId)
                    .signalId(signalId)
                    .symbol(symbol)
                    .reasonCodes(List.copyOf(reasonCodes))
                    .status(BlockStatus.OPEN)
                    .createdAt(LocalDateTime.now(clock))
                    .build();
            byId.put(fresh.getId(), fresh);
            return fresh;
        });

        BlockRecord copy = record.toBuilder().build();
        if (created.get()) {
            log.info("Opened block {} for {} on account {}: {}", copy.getId(), symbol, accountId, reasonCodes);
            eventPublisherHelper.publishBlockRecord(this, copy);
        } else {
            log.debug("Block already open for signal {} on account {}", signalId, accountId);
        }
        return new BlockOutcome(copy, created.get());
    }

    public BlockRecord resolve(String blockId, String resolvedBy) {
        BlockRecord record = byId.get(blockId);
        if (record == null) {
            throw new ResourceNotFoundException("BlockRecord", blockId);
        }
        String key = pairKey(record.getSignalId(), record.getAccountId());
        BlockRecord resolved = record.toBuilder()
                .status(BlockStatus.RESOLVED)
                .resolvedAt(LocalDateTime.now(clock))
                .resolvedBy(resolvedBy)
                .build();
        if (!openByPair.remove(key, record)) {
            throw new BusinessException("Block " + blockId + " is not open");
        }
        byId.put(blockId, resolved);
        log.info("Block {} resolved by {}", blockId, resolvedBy);
        return resolved.toBuilder().build();
    }

    public boolean hasOpenBlock(String signalId, String accountId) {
        return openByPair.containsKey(pairKey(signalId, accountId));
    }

    public Optional<BlockRecord> findById(String blockId) {
        BlockRecord record = byId.get(blockId);
        return record == null ? Optional.empty() : Optional.of(record.toBuilder().build());
    }

    public List<BlockRecord> getOpenBlocks() {
        return openByPair.values().stream()
                .map(r -> r.toBuilder().build())
                .sorted(Comparator.comparing(BlockRecord::getCreatedAt).thenComparing(BlockRecord::getId))
                .toList();
    }

    public List<BlockRecord> getOpenBlocks(String accountId) {
        return getOpenBlocks().stream()
                .filter(r -> accountId.equals(r.getAccountId()))
                .toList();
    }

    private static String pairKey(String signalId, String accountId) {
        return signalId + "|" + accountId;
    }
}
