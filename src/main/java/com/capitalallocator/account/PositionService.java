package com.capitalallocator.account;

import com.capitalallocator.allocation.TrancheReleaseService;
import com.capitalallocator.domain.enums.Direction;
import com.capitalallocator.domain.enums.PositionStatus;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.Position;
import com.capitalallocator.domain.model.TradeProposal;
import com.capitalallocator.exception.BusinessException;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.ledger.AccountLockRegistry;
import com.capitalallocator.ledger.CapitalLedger;
import com.capitalallocator.ledger.ReservationManager;
import com.capitalallocator.repository.PositionRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns fills into positions and closes them back into cash.
 *
 * <p>Opening deploys the proposal's reservation at the actual fill cost (any saving is released).
 * Closing returns the cost basis plus realized P&L to available cash. Both run under the account
 * lock so the position book and the ledger move together.
 */
@Service
public class PositionService {

    private static final Logger log = LoggerFactory.getLogger(PositionService.class);

    private final PositionRepository positionRepository;
    private final ReservationManager reservationManager;
    private final CapitalLedger capitalLedger;
    private final AccountLockRegistry lockRegistry;
    private final TrancheReleaseService trancheReleaseService;
    private final Clock clock;

    public PositionService(
            PositionRepository positionRepository,
            ReservationManager reservationManager,
            CapitalLedger capitalLedger,
            AccountLockRegistry lockRegistry,
            TrancheReleaseService trancheReleaseService,
            Clock clock) {
        this.positionRepository = positionRepository;
        this.reservationManager = reservationManager;
        this.capitalLedger = capitalLedger;
        this.lockRegistry = lockRegistry;
        this.trancheReleaseService = trancheReleaseService;
        this.clock = clock;
    }

    /**
     * Records the fill of a proposal.
     *
     * @throws com.capitalallocator.exception.StaleReservationException if the reservation is no
     *     longer pending
     * @throws BusinessException if the fill is empty or larger than the proposal
     */
    public Position openPosition(TradeProposal proposal, BigDecimal fillPrice, int filledQuantity) {
        if (filledQuantity <= 0 || filledQuantity > proposal.getQuantity()) {
            throw new BusinessException(
                    "Filled quantity " + filledQuantity + " outside 1.." + proposal.getQuantity(),
                    Map.of("proposalId", proposal.getId(), "filledQuantity", filledQuantity));
        }
        if (fillPrice == null || fillPrice.signum() <= 0) {
            throw new BusinessException("Fill price must be positive");
        }

        return lockRegistry.withLock(proposal.getAccountId(), () -> {
            BigDecimal cost = Money.notional(fillPrice, filledQuantity);
            reservationManager.deploy(proposal.getReservationId(), cost);

            LocalDateTime now = LocalDateTime.now(clock);
            Position position = Position.builder()
                    .id(UUID.randomUUID().toString())
                    .accountId(proposal.getAccountId())
                    .symbol(proposal.getSymbol())
                    .sector(proposal.getSector())
                    .direction(proposal.getDirection())
                    .quantity(filledQuantity)
                    .entryPrice(Money.of(fillPrice))
                    .stopLoss(proposal.getStopLoss())
                    .takeProfit(proposal.getTakeProfit())
                    .status(PositionStatus.OPEN)
                    .reservationId(proposal.getReservationId())
                    .openedAt(now)
                    .build();
            positionRepository.save(position);

            if (proposal.isStaged()) {
                trancheReleaseService.markFirstFill(proposal.getId(), now);
            }
            log.info(
                    "Opened position {}: {} {} x{} @ {} on account {}",
                    position.getId(),
                    position.getDirection(),
                    position.getSymbol(),
                    filledQuantity,
                    position.getEntryPrice(),
                    position.getAccountId());
            return position;
        });
    }

    /**
     * Closes an open position at {@code exitPrice} and books the realized P&L.
     *
     * @throws ResourceNotFoundException if the position does not exist
     * @throws BusinessException if it belongs to another account or is already closed
     */
    public Position closePosition(String accountId, String positionId, BigDecimal exitPrice) {
        if (exitPrice == null || exitPrice.signum() <= 0) {
            throw new BusinessException("Exit price must be positive");
        }
        return lockRegistry.withLock(accountId, () -> {
            Position position = positionRepository
                    .findById(positionId)
                    .orElseThrow(() -> new ResourceNotFoundException("Position", positionId));
            if (!accountId.equals(position.getAccountId())) {
                throw new BusinessException(
                        "Position " + positionId + " does not belong to account " + accountId,
                        Map.of("positionId", positionId, "ownerAccountId", position.getAccountId()));
            }
            if (!position.isOpen()) {
                throw new BusinessException(
                        "Position " + positionId + " is already closed", Map.of("positionId", positionId));
            }

            BigDecimal exit = Money.of(exitPrice);
            BigDecimal move = position.getDirection() == Direction.LONG
                    ? exit.subtract(position.getEntryPrice())
                    : position.getEntryPrice().subtract(exit);
            BigDecimal pnl = Money.of(move.multiply(BigDecimal.valueOf(position.getQuantity())));

            capitalLedger.returnToAvailable(accountId, Money.of(position.getNotional()), pnl, positionId);

            position.setStatus(PositionStatus.CLOSED);
            position.setExitPrice(exit);
            position.setRealizedPnl(pnl);
            position.setClosedAt(LocalDateTime.now(clock));
            positionRepository.save(position);

            log.info(
                    "Closed position {} ({} x{}) @ {} on account {}, realized P&L {}",
                    positionId,
                    position.getSymbol(),
                    position.getQuantity(),
                    exit,
                    accountId,
                    pnl);
            return position;
        });
    }

    public List<Position> getOpenPositions(String accountId) {
        return positionRepository.findOpenByAccount(accountId);
    }
}
