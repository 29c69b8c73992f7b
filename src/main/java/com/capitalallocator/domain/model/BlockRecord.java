package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.BlockStatus;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Audit record of a (signal, account) pair stopped by a CRITICAL guardrail. At most one OPEN
 * record exists per pair.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BlockRecord {

    private String id;
    private String accountId;
    private String signalId;
    private String symbol;

    @Builder.Default
    private List<String> reasonCodes = List.of();

    @Builder.Default
    private BlockStatus status = BlockStatus.OPEN;

    private LocalDateTime createdAt;
    private LocalDateTime resolvedAt;
    private String resolvedBy;

    public boolean isOpen() {
        return status == BlockStatus.OPEN;
    }
}
