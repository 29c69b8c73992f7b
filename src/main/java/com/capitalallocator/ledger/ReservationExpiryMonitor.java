package com.capitalallocator.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically releases reservations that outlived their TTL.
 */
@Component
public class ReservationExpiryMonitor {

    private static final Logger log = LoggerFactory.getLogger(ReservationExpiryMonitor.class);

    private final ReservationManager reservationManager;

    public ReservationExpiryMonitor(ReservationManager reservationManager) {
        this.reservationManager = reservationManager;
    }

    @Scheduled(fixedDelayString = "${allocator.ledger.expiry-sweep-interval-ms:30000}")
    public void sweep() {
        try {
            int expired = reservationManager.expireDue();
            if (expired > 0) {
                log.info("Expired {} stale reservations", expired);
            }
        } catch (RuntimeException e) {
            log.error("Reservation expiry sweep failed: {}", e.getMessage(), e);
        }
    }
}
