package com.capitalallocator.allocation;

import com.capitalallocator.domain.enums.AllocationOutcome;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.GuardrailResult;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.domain.model.Reservation;
import com.capitalallocator.domain.model.Signal;
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
import com.capitalallocator.sizing.SizingRequest;
import com.capitalallocator.sizing.SizingResult;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one account through the allocation pipeline for a batch of signals.
 *
 * <p>The whole run holds the account's ledger lock: filter, rank, then for each ranked signal
 * size, evaluate guardrails and reserve. Cash, open positions and pending reservations therefore
 * cannot change between a signal's guardrail evaluation and its reservation, and each signal sees
 * the cash left by the ones ranked above it.
 */
@Service
public class AccountAllocator {

    private static final Logger log = LoggerFactory.getLogger(AccountAllocator.class);

    private final AccountRepository accountRepository;
    private final MandateRepository mandateRepository;
    private final PositionRepository positionRepository;
    private final AccountLockRegistry lockRegistry;
    private final CapitalLedger capitalLedger;
    private final ReservationManager reservationManager;
    private final MarketDataProvider marketDataProvider;
    private final SnapshotValidator snapshotValidator;
    private final MandateFilter mandateFilter;
    private final PlaybookOverrideApplier overrideApplier;
    private final ObjectiveRanker objectiveRanker;
    private final PositionSizer positionSizer;
    private final GuardrailEvaluator guardrailEvaluator;
    private final BlockRecordService blockRecordService;
    private final TrancheReleaseService trancheReleaseService;
    private final AllocationConfig allocationConfig;
    private final AllocationMetricsService metricsService;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public AccountAllocator(
            AccountRepository accountRepository,
            MandateRepository mandateRepository,
            PositionRepository positionRepository,
            AccountLockRegistry lockRegistry,
            CapitalLedger capitalLedger,
            ReservationManager reservationManager,
            MarketDataProvider marketDataProvider,
            SnapshotValidator snapshotValidator,
            MandateFilter mandateFilter,
            PlaybookOverrideApplier overrideApplier,
            ObjectiveRanker objectiveRanker,
            PositionSizer positionSizer,
            GuardrailEvaluator guardrailEvaluator,
            BlockRecordService blockRecordService,
            TrancheReleaseService trancheReleaseService,
            AllocationConfig allocationConfig,
            AllocationMetricsService metricsService,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.accountRepository = accountRepository;
        this.mandateRepository = mandateRepository;
        this.positionRepository = positionRepository;
        this.lockRegistry = lockRegistry;
        this.capitalLedger = capitalLedger;
        this.reservationManager = reservationManager;
        this.marketDataProvider = marketDataProvider;
        this.snapshotValidator = snapshotValidator;
        this.mandateFilter = mandateFilter;
        this.overrideApplier = overrideApplier;
        this.objectiveRanker = objectiveRanker;
        this.positionSizer = positionSizer;
        this.guardrailEvaluator = guardrailEvaluator;
        this.blockRecordService = blockRecordService;
        this.trancheReleaseService = trancheReleaseService;
        this.allocationConfig = allocationConfig;
        this.metricsService = metricsService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    /**
     * Decides every signal for one account.
     *
     * @return one decision per signal: rejected signals first in input order, then ranked ones in
     *     rank order
     * @throws InvalidSnapshotException if the account or its current mandate is malformed
     */
    public List<AllocationDecision> allocateForAccount(String accountId, List<Signal> signals) {
        return lockRegistry.withLock(accountId, () -> {
            Account account = loadAccount(accountId);
            Mandate mandate = mandateRepository
                    .findCurrent(accountId)
                    .orElseThrow(() -> new InvalidSnapshotException("Account " + accountId + " has no mandate"));
            snapshotValidator.validate(account, mandate);

            List<AllocationDecision> decisions = new ArrayList<>();
            List<RankCandidate> candidates = new ArrayList<>();

            // ---- Mandate filter and market data ----
            for (Signal signal : signals) {
                MandateCheck check = mandateFilter.evaluate(signal, mandate, account);
                if (!check.isEligible()) {
                    AllocationOutcome outcome =
                            check.isPaused() ? AllocationOutcome.PAUSED : AllocationOutcome.INELIGIBLE;
                    decisions.add(rejected(accountId, signal, outcome, check.getReasons()));
                    continue;
                }
                Optional<MarketSnapshot> snapshot = marketDataProvider.getSnapshot(signal.getSymbol());
                if (snapshot.isEmpty()) {
                    decisions.add(rejected(accountId, signal, AllocationOutcome.NO_MARKET_DATA, List.of()));
                    continue;
                }
                candidates.add(new RankCandidate(signal, snapshot.get(), overrideApplier.apply(signal, mandate)));
            }

            // ---- Rank, then size / evaluate / reserve in rank order ----
            List<RankedSignal> ranked = objectiveRanker.rank(candidates, account.getObjective());
            int proposals = 0;
            int openSlots = positionRepository.findOpenByAccount(accountId).size()
                    + reservationManager.getPending(accountId).size();

            for (RankedSignal rankedSignal : ranked) {
                if (proposals >= allocationConfig.getMaxProposalsPerAccount()
                        || (mandate.getMaxOpenPositions() != null && openSlots >= mandate.getMaxOpenPositions())) {
                    decisions.add(AllocationDecision.builder()
                            .accountId(accountId)
                            .signalId(rankedSignal.signal().getId())
                            .symbol(rankedSignal.signal().getSymbol())
                            .outcome(AllocationOutcome.CAPACITY_REACHED)
                            .score(rankedSignal.score())
                            .build());
                    continue;
                }
                AllocationDecision decision = allocateOne(accountId, mandate, rankedSignal);
                if (decision.isProposed()) {
                    proposals++;
                    openSlots++;
                }
                decisions.add(decision);
            }

            log.info(
                    "Account {}: {} signals, {} eligible, {} proposals",
                    accountId,
                    signals.size(),
                    ranked.size(),
                    proposals);
            return decisions;
        });
    }

    private AllocationDecision allocateOne(String accountId, Mandate mandate, RankedSignal rankedSignal) {
        Signal signal = rankedSignal.signal();
        MarketSnapshot snapshot = rankedSignal.snapshot();
        Account account = loadAccount(accountId);

        // ---- Size ----
        SizingResult sizing = positionSizer.size(SizingRequest.builder()
                .signal(signal)
                .account(account)
                .mandate(mandate)
                .entryPrice(snapshot.getPrice())
                .atr(snapshot.getAtr())
                .deployableCash(capitalLedger.getDeployableCash(accountId))
                .parameters(rankedSignal.parameters())
                .build());
        AllocationDecision.AllocationDecisionBuilder decision = AllocationDecision.builder()
                .accountId(accountId)
                .signalId(signal.getId())
                .symbol(signal.getSymbol())
                .score(rankedSignal.score())
                .sizing(sizing);
        if (sizing.isZero()) {
            return decision.outcome(AllocationOutcome.ZERO_SIZE)
                    .reasons(List.of(sizing.getBindingConstraint().name()))
                    .build();
        }

        // ---- Guardrails ----
        LocalDateTime now = LocalDateTime.now(clock);
        GuardrailResult guardrailResult = guardrailEvaluator.evaluate(GuardrailContext.builder()
                .signal(signal)
                .account(account)
                .mandate(mandate)
                .snapshot(snapshot)
                .quantity(sizing.getQuantity())
                .entryPrice(sizing.getEntryPrice())
                .stopLoss(sizing.getStopLoss())
                .openPositions(positionRepository.findOpenByAccount(accountId))
                .pendingReservations(reservationManager.getPending(accountId))
                .evaluatedAt(now)
                .build());
        decision.guardrailResult(guardrailResult);

        if (guardrailEvaluator.isBlocking(guardrailResult)) {
            List<String> codes = guardrailEvaluator.blockingCodes(guardrailResult);
            BlockOutcome block = blockRecordService.openBlock(signal.getId(), accountId, signal.getSymbol(), codes);
            return decision.outcome(block.created() ? AllocationOutcome.BLOCKED : AllocationOutcome.DUPLICATE_BLOCK)
                    .blockRecord(block.blockRecord())
                    .reasons(codes)
                    .build();
        }

        // ---- Reserve ----
        Optional<Reservation> reservation = reservationManager.reserve(
                accountId, sizing.getNotional(), signal.getSymbol(), signal.getSector(), signal.getId());
        if (reservation.isEmpty()) {
            metricsService.recordInsufficientFunds();
            return decision.outcome(AllocationOutcome.INSUFFICIENT_FUNDS).build();
        }

        TradeProposal proposal = TradeProposal.builder()
                .id(UUID.randomUUID().toString())
                .accountId(accountId)
                .signalId(signal.getId())
                .symbol(signal.getSymbol())
                .sector(signal.getSector())
                .direction(signal.getDirection())
                .quantity(sizing.getQuantity())
                .tranches(sizing.getTranches())
                .entryPrice(sizing.getEntryPrice())
                .stopLoss(sizing.getStopLoss())
                .takeProfit(sizing.getTakeProfit())
                .reservedAmount(reservation.get().getAmount())
                .reservationId(reservation.get().getId())
                .riskAmount(sizing.getRiskAmount())
                .guardrailResult(guardrailResult)
                .score(rankedSignal.score())
                .createdAt(now)
                .build();

        if (proposal.isStaged()) {
            trancheReleaseService.register(proposal, signal);
        }
        eventPublisherHelper.publishTradeProposal(this, proposal);
        log.info(
                "Proposed {} {} x{} @ {} for account {} (reserved {}, stop {}, target {})",
                proposal.getDirection(),
                proposal.getSymbol(),
                proposal.getQuantity(),
                proposal.getEntryPrice(),
                accountId,
                proposal.getReservedAmount(),
                proposal.getStopLoss(),
                proposal.getTakeProfit());

        return decision.outcome(AllocationOutcome.PROPOSED)
                .proposal(proposal)
                .reasons(guardrailResult.getWarningCodes())
                .build();
    }

    private Account loadAccount(String accountId) {
        return accountRepository
                .findById(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));
    }

    private static AllocationDecision rejected(
            String accountId, Signal signal, AllocationOutcome outcome, List<String> reasons) {
        return AllocationDecision.builder()
                .accountId(accountId)
                .signalId(signal.getId())
                .symbol(signal.getSymbol())
                .outcome(outcome)
                .reasons(reasons)
                .build();
    }
}
