package com.capitalallocator.exception;

import com.capitalallocator.domain.enums.ReservationStatus;
import java.util.Map;

/**
 * Deploy attempted against a reservation that is no longer pending (expired, released
 * or already deployed). The proposal must be discarded and cash re-acquired.
 */
public class StaleReservationException extends BaseException {

    public StaleReservationException(String reservationId, ReservationStatus status) {
        super(
                ErrorCode.STALE_RESERVATION,
                "Reservation " + reservationId + " is not deployable (status " + status + ")",
                Map.of("reservationId", reservationId, "status", status.name()));
    }
}
