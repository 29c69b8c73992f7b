package com.capitalallocator.ledger;

import com.capitalallocator.domain.enums.ReservationStatus;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.Reservation;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.event.RiskEventType;
import com.capitalallocator.event.RiskLevel;
import com.capitalallocator.exception.LedgerContractException;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.exception.StaleReservationException;
import com.capitalallocator.repository.ReservationRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Tracks the cash reserved for each trade proposal and its time to live.
 *
 * <p>A reservation is PENDING until exactly one of deploy, release or expiry moves it on. The
 * status change and the ledger mutation happen together under the account lock, so a deploy
 * racing an expiry sees either a pending reservation (and deploys) or a terminal one (and gets
 * {@link StaleReservationException}); cash is never moved twice.
 */
@Service
public class ReservationManager {

    private static final Logger log = LoggerFactory.getLogger(ReservationManager.class);

    private final CapitalLedger capitalLedger;
    private final ReservationRepository reservationRepository;
    private final AccountLockRegistry lockRegistry;
    private final LedgerConfig ledgerConfig;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public ReservationManager(
            CapitalLedger capitalLedger,
            ReservationRepository reservationRepository,
            AccountLockRegistry lockRegistry,
            LedgerConfig ledgerConfig,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.capitalLedger = capitalLedger;
        this.reservationRepository = reservationRepository;
        this.lockRegistry = lockRegistry;
        this.ledgerConfig = ledgerConfig;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Reserves {@code amount} on the ledger and registers a pending reservation for it.
     *
     * @return the reservation, or empty when the account lacks available cash
     */
    public Optional<Reservation> reserve(
            String accountId, BigDecimal amount, String symbol, String sector, String reference) {
        return lockRegistry.withLock(accountId, () -> {
            String reservationId = UUID.randomUUID().toString();
            ReserveResult result = capitalLedger.reserve(accountId, amount, ledgerReference(reference, reservationId));
            if (!result.isOk()) {
                return Optional.<Reservation>empty();
            }
            LocalDateTime now = LocalDateTime.now(clock);
            Reservation reservation = Reservation.builder()
                    .id(reservationId)
                    .accountId(accountId)
                    .amount(Money.of(amount))
                    .symbol(symbol)
                    .sector(sector)
                    .reference(reference)
                    .createdAt(now)
                    .expiresAt(now.plus(ledgerConfig.getReservationTtl()))
                    .status(ReservationStatus.PENDING)
                    .build();
            reservationRepository.save(reservation);
            log.debug("Reserved {} for {} on account {} until {}", reservation.getAmount(), symbol, accountId,
                    reservation.getExpiresAt());
            return Optional.of(reservation);
        });
    }

    /**
     * Deploys a pending reservation after a fill. A fill cheaper than the reservation deploys the
     * actual cost and releases the remainder.
     *
     * @throws StaleReservationException if the reservation expired, was released or already deployed
     */
    public Reservation deploy(String reservationId, BigDecimal actualCost) {
        Reservation snapshot = find(reservationId);
        return lockRegistry.withLock(snapshot.getAccountId(), () -> {
            Reservation reservation = find(reservationId);
            LocalDateTime now = LocalDateTime.now(clock);
            if (reservation.isPending() && reservation.isExpiredAt(now)) {
                expire(reservation);
                reservation = find(reservationId);
            }
            if (!reservation.isPending()) {
                log.warn("Deploy refused for reservation {}: status {}", reservationId, reservation.getStatus());
                throw new StaleReservationException(reservationId, reservation.getStatus());
            }

            BigDecimal cost = Money.of(actualCost);
            if (cost.signum() <= 0 || cost.compareTo(reservation.getAmount()) > 0) {
                throw new LedgerContractException(
                        "Deploy of " + cost + " does not fit reservation " + reservationId + " of "
                                + reservation.getAmount(),
                        Map.of("reservationId", reservationId, "amount", cost, "reserved", reservation.getAmount()));
            }

            String ledgerReference = ledgerReference(reservation);
            capitalLedger.deploy(reservation.getAccountId(), cost, ledgerReference);
            BigDecimal remainder = reservation.getAmount().subtract(cost);
            if (remainder.signum() > 0) {
                capitalLedger.releaseReservation(reservation.getAccountId(), remainder, ledgerReference);
            }
            reservation.setStatus(ReservationStatus.DEPLOYED);
            reservationRepository.save(reservation);
            return reservation;
        });
    }

    /** Releases a pending reservation, e.g. when the approver rejects the proposal. */
    public Reservation release(String reservationId) {
        Reservation snapshot = find(reservationId);
        return lockRegistry.withLock(snapshot.getAccountId(), () -> {
            Reservation reservation = find(reservationId);
            if (!reservation.isPending()) {
                throw new StaleReservationException(reservationId, reservation.getStatus());
            }
            capitalLedger.releaseReservation(
                    reservation.getAccountId(), reservation.getAmount(), ledgerReference(reservation));
            reservation.setStatus(ReservationStatus.RELEASED);
            reservationRepository.save(reservation);
            log.info("Released reservation {} ({} on account {})", reservationId, reservation.getAmount(),
                    reservation.getAccountId());
            return reservation;
        });
    }

    /**
     * Releases every pending reservation whose TTL has passed.
     *
     * @return number of reservations expired
     */
    public int expireDue() {
        LocalDateTime now = LocalDateTime.now(clock);
        int expired = 0;
        for (Reservation candidate : reservationRepository.findPending()) {
            if (!candidate.isExpiredAt(now)) {
                continue;
            }
            boolean done = lockRegistry.withLock(candidate.getAccountId(), () -> {
                Reservation current = find(candidate.getId());
                if (!current.isPending()) {
                    return false;
                }
                expire(current);
                return true;
            });
            if (done) {
                expired++;
            }
        }
        return expired;
    }

    public List<Reservation> getPending(String accountId) {
        return reservationRepository.findPendingByAccount(accountId);
    }

    public Reservation get(String reservationId) {
        return find(reservationId);
    }

    private void expire(Reservation reservation) {
        capitalLedger.releaseReservation(
                reservation.getAccountId(), reservation.getAmount(), ledgerReference(reservation));
        reservation.setStatus(ReservationStatus.EXPIRED);
        reservationRepository.save(reservation);
        log.info("Reservation {} expired, released {} to account {}", reservation.getId(), reservation.getAmount(),
                reservation.getAccountId());
        eventPublisherHelper.publishRiskEvent(
                this,
                reservation.getAccountId(),
                RiskEventType.RESERVATION_EXPIRED,
                RiskLevel.INFO,
                "Reservation for " + reservation.getSymbol() + " expired",
                Map.of("reservationId", reservation.getId(), "amount", reservation.getAmount()));
    }

    private static String ledgerReference(Reservation reservation) {
        return ledgerReference(reservation.getReference(), reservation.getId());
    }

    /** Ledger entries carry {@code signalId/reservationId} so the audit log joins back to signals. */
    private static String ledgerReference(String reference, String reservationId) {
        return reference != null ? reference + "/" + reservationId : reservationId;
    }

    private Reservation find(String reservationId) {
        return reservationRepository
                .findById(reservationId)
                .orElseThrow(() -> new ResourceNotFoundException("Reservation", reservationId));
    }
}
