package com.capitalallocator.unit.account;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.capitalallocator.account.PositionService;
import com.capitalallocator.allocation.TrancheReleaseService;
import com.capitalallocator.domain.enums.Direction;
import com.capitalallocator.domain.enums.PositionStatus;
import com.capitalallocator.domain.model.LedgerBalance;
import com.capitalallocator.domain.model.Position;
import com.capitalallocator.domain.model.Reservation;
import com.capitalallocator.domain.model.TradeProposal;
import com.capitalallocator.domain.model.Tranche;
import com.capitalallocator.domain.model.TrancheReleaseCondition;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.exception.BusinessException;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.exception.StaleReservationException;
import com.capitalallocator.ledger.AccountLockRegistry;
import com.capitalallocator.ledger.CapitalLedger;
import com.capitalallocator.ledger.LedgerConfig;
import com.capitalallocator.ledger.ReservationManager;
import com.capitalallocator.repository.AccountRepository;
import com.capitalallocator.repository.CapitalTransactionRepository;
import com.capitalallocator.repository.PositionRepository;
import com.capitalallocator.repository.ReservationRepository;
import com.capitalallocator.support.Fixtures;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for PositionService: fills deploy the reservation, closes return cost basis plus
 * realized P&L to available cash.
 */
@ExtendWith(MockitoExtension.class)
class PositionServiceTest {

    private static final BigDecimal HUNDRED = new BigDecimal("100");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    @Mock
    private TrancheReleaseService trancheReleaseService;

    private CapitalLedger capitalLedger;
    private ReservationManager reservationManager;
    private PositionService positionService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Fixtures.NOW.atZone(Fixtures.ZONE).toInstant(), Fixtures.ZONE);
        AccountRepository accountRepository = new AccountRepository();
        AccountLockRegistry lockRegistry = new AccountLockRegistry();
        capitalLedger = new CapitalLedger(
                accountRepository, new CapitalTransactionRepository(), lockRegistry, eventPublisherHelper, clock);
        reservationManager = new ReservationManager(
                capitalLedger, new ReservationRepository(), lockRegistry, new LedgerConfig(), eventPublisherHelper,
                clock);
        positionService = new PositionService(
                new PositionRepository(), reservationManager, capitalLedger, lockRegistry, trancheReleaseService, clock);

        accountRepository.save(Fixtures.account("ACC-1")
                .totalCapital(BigDecimal.ZERO)
                .availableCash(BigDecimal.ZERO)
                .build());
        capitalLedger.deposit("ACC-1", new BigDecimal("100000"), "opening-balance");
    }

    private TradeProposal proposal(Direction direction, int quantity, String price, List<Tranche> tranches) {
        BigDecimal entry = new BigDecimal(price);
        boolean isLong = direction == Direction.LONG;
        BigDecimal amount = entry.multiply(BigDecimal.valueOf(quantity));
        Reservation reservation = reservationManager
                .reserve("ACC-1", amount, "RELIANCE", "ENERGY", "SIG-1")
                .orElseThrow();
        return TradeProposal.builder()
                .id("P-1")
                .accountId("ACC-1")
                .signalId("SIG-1")
                .symbol("RELIANCE")
                .sector("ENERGY")
                .direction(direction)
                .quantity(quantity)
                .tranches(tranches)
                .entryPrice(entry)
                .stopLoss(isLong ? entry.subtract(HUNDRED) : entry.add(HUNDRED))
                .takeProfit(isLong ? entry.add(HUNDRED.add(HUNDRED)) : entry.subtract(HUNDRED.add(HUNDRED)))
                .reservedAmount(amount)
                .reservationId(reservation.getId())
                .createdAt(Fixtures.NOW)
                .build();
    }

    private TradeProposal longProposal() {
        return proposal(Direction.LONG, 20, "2450", List.of());
    }

    // ========================
    // OPEN
    // ========================

    @Nested
    @DisplayName("Open position")
    class Open {

        @Test
        @DisplayName("Fill at the proposed price deploys the whole reservation")
        void open_fullFill() {
            Position position = positionService.openPosition(longProposal(), new BigDecimal("2450"), 20);

            assertThat(position.getStatus()).isEqualTo(PositionStatus.OPEN);
            assertThat(position.getStopLoss()).isEqualByComparingTo("2350");
            LedgerBalance balance = capitalLedger.getBalance("ACC-1");
            assertThat(balance.deployedCash()).isEqualByComparingTo("49000");
            assertThat(balance.reservedCash()).isEqualByComparingTo("0");
            assertThat(balance.availableCash()).isEqualByComparingTo("51000");
            verify(trancheReleaseService, never()).markFirstFill(any(), any());
        }

        @Test
        @DisplayName("A partial fill releases the unused part of the reservation")
        void open_partialFill() {
            positionService.openPosition(longProposal(), new BigDecimal("2440"), 15);

            LedgerBalance balance = capitalLedger.getBalance("ACC-1");
            assertThat(balance.deployedCash()).isEqualByComparingTo("36600");
            assertThat(balance.reservedCash()).isEqualByComparingTo("0");
            assertThat(balance.availableCash()).isEqualByComparingTo("63400");
        }

        @Test
        @DisplayName("Fill of a staged proposal starts the tranche delay clock")
        void open_staged() {
            List<Tranche> tranches = List.of(
                    new Tranche(0, new BigDecimal("50"), 10, new TrancheReleaseCondition(0)),
                    new Tranche(1, new BigDecimal("50"), 10, new TrancheReleaseCondition(1)));
            TradeProposal staged = proposal(Direction.LONG, 10, "2450", tranches);

            positionService.openPosition(staged, new BigDecimal("2450"), 10);

            verify(trancheReleaseService).markFirstFill(eq("P-1"), eq(Fixtures.NOW));
        }

        @Test
        @DisplayName("Overfills and empty fills are rejected")
        void open_invalidQuantity() {
            TradeProposal proposal = longProposal();

            assertThatThrownBy(() -> positionService.openPosition(proposal, new BigDecimal("2450"), 21))
                    .isInstanceOf(BusinessException.class);
            assertThatThrownBy(() -> positionService.openPosition(proposal, new BigDecimal("2450"), 0))
                    .isInstanceOf(BusinessException.class);
            assertThat(capitalLedger.getBalance("ACC-1").reservedCash()).isEqualByComparingTo("49000");
        }

        @Test
        @DisplayName("A second fill against the same reservation is stale")
        void open_twice() {
            TradeProposal proposal = longProposal();
            positionService.openPosition(proposal, new BigDecimal("2450"), 20);

            assertThatThrownBy(() -> positionService.openPosition(proposal, new BigDecimal("2450"), 20))
                    .isInstanceOf(StaleReservationException.class);
            assertThat(positionService.getOpenPositions("ACC-1")).hasSize(1);
        }
    }

    // ========================
    // CLOSE
    // ========================

    @Nested
    @DisplayName("Close position")
    class Close {

        @Test
        @DisplayName("Long gain returns cost plus profit")
        void close_longGain() {
            Position position = positionService.openPosition(longProposal(), new BigDecimal("2450"), 20);

            Position closed = positionService.closePosition("ACC-1", position.getId(), new BigDecimal("2550"));

            assertThat(closed.getStatus()).isEqualTo(PositionStatus.CLOSED);
            assertThat(closed.getRealizedPnl()).isEqualByComparingTo("2000");
            LedgerBalance balance = capitalLedger.getBalance("ACC-1");
            assertThat(balance.deployedCash()).isEqualByComparingTo("0");
            assertThat(balance.availableCash()).isEqualByComparingTo("102000");
            assertThat(positionService.getOpenPositions("ACC-1")).isEmpty();
        }

        @Test
        @DisplayName("Long loss reduces available cash")
        void close_longLoss() {
            Position position = positionService.openPosition(longProposal(), new BigDecimal("2450"), 20);

            Position closed = positionService.closePosition("ACC-1", position.getId(), new BigDecimal("2350"));

            assertThat(closed.getRealizedPnl()).isEqualByComparingTo("-2000");
            assertThat(capitalLedger.getBalance("ACC-1").availableCash()).isEqualByComparingTo("98000");
        }

        @Test
        @DisplayName("Short profits when the price falls")
        void close_shortGain() {
            TradeProposal shortProposal = proposal(Direction.SHORT, 10, "1000", List.of());
            Position position = positionService.openPosition(shortProposal, new BigDecimal("1000"), 10);

            Position closed = positionService.closePosition("ACC-1", position.getId(), new BigDecimal("900"));

            assertThat(closed.getRealizedPnl()).isEqualByComparingTo("1000");
            assertThat(capitalLedger.getBalance("ACC-1").availableCash()).isEqualByComparingTo("101000");
        }

        @Test
        @DisplayName("Closing twice, on the wrong account or an unknown id fails")
        void close_invalid() {
            Position position = positionService.openPosition(longProposal(), new BigDecimal("2450"), 20);

            assertThatThrownBy(() -> positionService.closePosition("ACC-2", position.getId(), new BigDecimal("2500")))
                    .isInstanceOf(BusinessException.class)
                    .hasFieldOrPropertyWithValue(
                            "details", Map.of("positionId", position.getId(), "ownerAccountId", "ACC-1"));

            positionService.closePosition("ACC-1", position.getId(), new BigDecimal("2500"));
            assertThatThrownBy(() -> positionService.closePosition("ACC-1", position.getId(), new BigDecimal("2500")))
                    .isInstanceOf(BusinessException.class);
            assertThatThrownBy(() -> positionService.closePosition("ACC-1", "missing", new BigDecimal("2500")))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
