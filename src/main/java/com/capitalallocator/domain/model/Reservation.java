package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.ReservationStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cash held against a proposal until it is deployed, released or expires. Only PENDING
 * reservations hold ledger cash.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Reservation {

    private String id;
    private String accountId;
    private BigDecimal amount;
    private String symbol;
    private String sector;
    private String reference;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;

    @Builder.Default
    private ReservationStatus status = ReservationStatus.PENDING;

    public boolean isPending() {
        return status == ReservationStatus.PENDING;
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
