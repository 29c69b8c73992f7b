package com.capitalallocator.allocation;

import com.capitalallocator.domain.enums.Direction;
import com.capitalallocator.domain.enums.TrancheReleaseStatus;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.GuardrailResult;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.Reservation;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.domain.model.Tranche;
import com.capitalallocator.domain.model.TradeProposal;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.exception.InvalidSnapshotException;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.guardrail.BlockOutcome;
import com.capitalallocator.guardrail.BlockRecordService;
import com.capitalallocator.guardrail.GuardrailContext;
import com.capitalallocator.guardrail.GuardrailEvaluator;
import com.capitalallocator.ledger.AccountLockRegistry;
import com.capitalallocator.ledger.CapitalLedger;
import com.capitalallocator.ledger.ReservationManager;
import com.capitalallocator.market.MarketDataProvider;
import com.capitalallocator.observability.AllocationMetricsService;
import com.capitalallocator.repository.AccountRepository;
import com.capitalallocator.repository.MandateRepository;
import com.capitalallocator.repository.PositionRepository;
import com.capitalallocator.sizing.PositionSizer;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Releases the later tranches of staged proposals.
 *
 * <p>A proposal with more than one tranche reserves only its first tranche up front. The rest are
 * registered here and become due {@code delayDays} after the first fill. Each release re-sizes the
 * tranche against current cash and price, runs the full guardrail set, and reserves before it
 * emits a new proposal. Everything happens under the account lock, the same as a fresh allocation.
 *
 * <p>A tranche that cannot go out (not due, paused, no cash, blocked) stays pending and is retried
 * on the next sweep.
 */
@Service
public class TrancheReleaseService {

    private static final Logger log = LoggerFactory.getLogger(TrancheReleaseService.class);

    private final AccountLockRegistry lockRegistry;
    private final AccountRepository accountRepository;
    private final MandateRepository mandateRepository;
    private final PositionRepository positionRepository;
    private final CapitalLedger capitalLedger;
    private final ReservationManager reservationManager;
    private final MarketDataProvider marketDataProvider;
    private final PositionSizer positionSizer;
    private final GuardrailEvaluator guardrailEvaluator;
    private final BlockRecordService blockRecordService;
    private final AllocationMetricsService metricsService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final Map<String, StagedProposal> staged = new ConcurrentHashMap<>();

    public TrancheReleaseService(
            AccountLockRegistry lockRegistry,
            AccountRepository accountRepository,
            MandateRepository mandateRepository,
            PositionRepository positionRepository,
            CapitalLedger capitalLedger,
            ReservationManager reservationManager,
            MarketDataProvider marketDataProvider,
            PositionSizer positionSizer,
            GuardrailEvaluator guardrailEvaluator,
            BlockRecordService blockRecordService,
            AllocationMetricsService metricsService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.lockRegistry = lockRegistry;
        this.accountRepository = accountRepository;
        this.mandateRepository = mandateRepository;
        this.positionRepository = positionRepository;
        this.capitalLedger = capitalLedger;
        this.reservationManager = reservationManager;
        this.marketDataProvider = marketDataProvider;
        this.positionSizer = positionSizer;
        this.guardrailEvaluator = guardrailEvaluator;
        this.blockRecordService = blockRecordService;
        this.metricsService = metricsService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // REGISTRATION
    // ========================

    public void register(TradeProposal proposal, Signal signal) {
        if (!proposal.isStaged()) {
            return;
        }
        staged.put(
                proposal.getId(),
                StagedProposal.builder()
                        .proposal(proposal)
                        .signal(signal)
                        .nextIndex(1)
                        .build());
        log.info(
                "Registered {} staged tranches for proposal {} ({} on account {})",
                proposal.getTranches().size() - 1,
                proposal.getId(),
                proposal.getSymbol(),
                proposal.getAccountId());
    }

    /** Starts the tranche clock. Later calls for the same proposal are ignored. */
    public void markFirstFill(String proposalId, LocalDateTime filledAt) {
        staged.computeIfPresent(proposalId, (id, entry) -> {
            if (entry.getFirstFilledAt() == null) {
                entry.setFirstFilledAt(filledAt);
            }
            return entry;
        });
    }

    public void cancel(String proposalId) {
        if (staged.remove(proposalId) != null) {
            log.info("Cancelled remaining tranches of proposal {}", proposalId);
        }
    }

    public Optional<StagedProposal> getStaged(String proposalId) {
        return Optional.ofNullable(staged.get(proposalId));
    }

    public List<StagedProposal> getStaged() {
        return List.copyOf(staged.values());
    }

    // ========================
    // RELEASE
    // ========================

    @Scheduled(fixedDelayString = "${allocator.tranches.release-interval-ms:60000}")
    public void releaseDueTranches() {
        try {
            int released = releaseDue();
            if (released > 0) {
                log.info("Released {} staged tranches", released);
            }
        } catch (RuntimeException e) {
            log.error("Tranche release sweep failed: {}", e.getMessage(), e);
        }
    }

    /** Attempts one release for every staged proposal; returns how many went out. */
    public int releaseDue() {
        int released = 0;
        for (String proposalId : new ArrayList<>(staged.keySet())) {
            try {
                if (releaseNextTranche(proposalId).status() == TrancheReleaseStatus.RELEASED) {
                    released++;
                }
            } catch (InvalidSnapshotException | ResourceNotFoundException e) {
                log.error("Cannot release tranche of proposal {}: {}", proposalId, e.getMessage());
            }
        }
        return released;
    }

    /**
     * Releases the next tranche of a staged proposal if it is due.
     *
     * @throws ResourceNotFoundException if the proposal is not staged
     */
    public TrancheRelease releaseNextTranche(String proposalId) {
        StagedProposal entry = staged.get(proposalId);
        if (entry == null) {
            throw new ResourceNotFoundException("StagedProposal", proposalId);
        }
        String accountId = entry.getProposal().getAccountId();
        return lockRegistry.withLock(accountId, () -> release(entry));
    }

    private TrancheRelease release(StagedProposal entry) {
        TradeProposal parent = entry.getProposal();
        Signal signal = entry.getSignal();
        String accountId = parent.getAccountId();

        if (entry.isComplete()) {
            staged.remove(parent.getId());
            return TrancheRelease.of(TrancheReleaseStatus.COMPLETE, entry.getNextIndex());
        }
        Tranche tranche = parent.getTranches().get(entry.getNextIndex());

        Account account = accountRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
        if (account.isPaused() || !account.isActive()) {
            return TrancheRelease.of(TrancheReleaseStatus.PAUSED, tranche.index());
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (entry.getFirstFilledAt() == null
                || now.isBefore(entry.getFirstFilledAt().plusDays(tranche.releaseCondition().delayDays()))) {
            return TrancheRelease.of(TrancheReleaseStatus.NOT_DUE, tranche.index());
        }

        Optional<MarketSnapshot> snapshot = marketDataProvider.getSnapshot(parent.getSymbol());
        if (snapshot.isEmpty()) {
            return TrancheRelease.of(TrancheReleaseStatus.NO_MARKET_DATA, tranche.index());
        }
        BigDecimal price = Money.of(snapshot.get().getPrice());

        // ---- Re-size against current cash; stop and target stay with the position ----
        int quantity = stopStillValid(parent, price)
                ? positionSizer.capByCash(tranche.quantity(), price, capitalLedger.getDeployableCash(accountId))
                : 0;
        if (quantity <= 0) {
            return TrancheRelease.of(TrancheReleaseStatus.ZERO_SIZE, tranche.index());
        }

        Mandate mandate = mandateRepository
                .findCurrent(accountId)
                .orElseThrow(() -> new InvalidSnapshotException("Account " + accountId + " has no mandate"));
        GuardrailResult guardrailResult = guardrailEvaluator.evaluate(GuardrailContext.builder()
                .signal(signal)
                .account(account)
                .mandate(mandate)
                .snapshot(snapshot.get())
                .quantity(quantity)
                .entryPrice(price)
                .stopLoss(parent.getStopLoss())
                .openPositions(positionRepository.findOpenByAccount(accountId))
                .pendingReservations(reservationManager.getPending(accountId))
                .evaluatedAt(now)
                .build());

        if (guardrailEvaluator.isBlocking(guardrailResult)) {
            BlockOutcome block = blockRecordService.openBlock(
                    signal.getId(), accountId, parent.getSymbol(), guardrailEvaluator.blockingCodes(guardrailResult));
            return new TrancheRelease(
                    TrancheReleaseStatus.BLOCKED, tranche.index(), null, guardrailResult, block.blockRecord());
        }

        BigDecimal notional = Money.notional(price, quantity);
        String reference = signal.getId() + "#" + tranche.index();
        Optional<Reservation> reservation =
                reservationManager.reserve(accountId, notional, parent.getSymbol(), parent.getSector(), reference);
        if (reservation.isEmpty()) {
            metricsService.recordInsufficientFunds();
            return new TrancheRelease(
                    TrancheReleaseStatus.INSUFFICIENT_FUNDS, tranche.index(), null, guardrailResult, null);
        }

        TradeProposal proposal = TradeProposal.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .signalId(signal.getId())
                .symbol(parent.getSymbol())
                .sector(parent.getSector())
                .direction(parent.getDirection())
                .quantity(quantity)
                .tranches(List.of(new Tranche(tranche.index(), tranche.percent(), quantity, tranche.releaseCondition())))
                .entryPrice(price)
                .stopLoss(parent.getStopLoss())
                .takeProfit(parent.getTakeProfit())
                .reservedAmount(reservation.get().getAmount())
                .reservationId(reservation.get().getId())
                .riskAmount(Money.of(price.subtract(parent.getStopLoss()).abs().multiply(BigDecimal.valueOf(quantity))))
                .guardrailResult(guardrailResult)
                .score(parent.getScore())
                .createdAt(now)
                .build();

        entry.setNextIndex(entry.getNextIndex() + 1);
        if (entry.isComplete()) {
            staged.remove(parent.getId());
        }
        eventPublisherHelper.publishTradeProposal(this, proposal);
        log.info(
                "Released tranche {} of proposal {}: {} {} x{} @ {} (reserved {})",
                tranche.index(),
                parent.getId(),
                proposal.getDirection(),
                proposal.getSymbol(),
                quantity,
                price,
                proposal.getReservedAmount());

        return new TrancheRelease(TrancheReleaseStatus.RELEASED, tranche.index(), proposal, guardrailResult, null);
    }

    /** A tranche is not added once price has moved through the position's stop. */
    private static boolean stopStillValid(TradeProposal parent, BigDecimal price) {
        int cmp = price.compareTo(parent.getStopLoss());
        return parent.getDirection() == Direction.LONG ? cmp > 0 : cmp < 0;
    }
}
