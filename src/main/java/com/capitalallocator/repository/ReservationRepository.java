package com.capitalallocator.repository;

import com.capitalallocator.domain.enums.ReservationStatus;
import com.capitalallocator.domain.model.Reservation;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of reservations, keyed by reservation id. Entities are copied on the way in
 * and out; status changes go through {@link com.capitalallocator.ledger.ReservationManager}.
 */
@Repository
public class ReservationRepository {

    private final Map<String, Reservation> reservations = new ConcurrentHashMap<>();

    public void save(Reservation reservation) {
        reservations.put(reservation.getId(), reservation.toBuilder().build());
    }

    public Optional<Reservation> findById(String id) {
        Reservation reservation = reservations.get(id);
        return reservation == null ? Optional.empty() : Optional.of(reservation.toBuilder().build());
    }

    public List<Reservation> findPending() {
        return reservations.values().stream()
                .filter(r -> r.getStatus() == ReservationStatus.PENDING)
                .map(r -> r.toBuilder().build())
                .sorted(Comparator.comparing(Reservation::getCreatedAt))
                .toList();
    }

    public List<Reservation> findPendingByAccount(String accountId) {
        return findPending().stream()
                .filter(r -> accountId.equals(r.getAccountId()))
                .toList();
    }
}
