package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.TransactionType;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Append-only ledger entry. Replaying an account's entries in order reproduces its balances
 * (see {@link com.capitalallocator.ledger.LedgerReplayer}).
 */
@Getter
@ToString
@Builder
public class CapitalTransaction {

    private final long id;
    private final String accountId;
    private final TransactionType type;

    /** Always positive; direction comes from {@link #type}. */
    private final BigDecimal amount;

    /** Realized P&L booked with a RETURN; zero for every other type. */
    @Builder.Default
    private final BigDecimal realizedPnl = BigDecimal.ZERO;

    private final LocalDateTime timestamp;

    /**
     * What caused the entry. Reservation entries read {@code signalId/reservationId}; returns carry
     * the position id and capital flows the caller's reference.
     */
    private final String reference;

    /** Other side of a transfer. */
    private final String counterpartyAccountId;

    /** Shared by the TRANSFER_OUT and TRANSFER_IN legs of one transfer. */
    private final String linkId;
}
