package com.capitalallocator.support;

import com.capitalallocator.account.AccountService;
import com.capitalallocator.account.PositionService;
import com.capitalallocator.allocation.AccountAllocator;
import com.capitalallocator.allocation.AllocationConfig;
import com.capitalallocator.allocation.AllocationEngine;
import com.capitalallocator.allocation.MandateFilter;
import com.capitalallocator.allocation.ObjectiveRanker;
import com.capitalallocator.allocation.PlaybookOverrideApplier;
import com.capitalallocator.allocation.RankingConfig;
import com.capitalallocator.allocation.SnapshotValidator;
import com.capitalallocator.allocation.TrancheReleaseService;
import com.capitalallocator.event.BlockRecordEvent;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.event.RiskEvent;
import com.capitalallocator.event.RiskEventType;
import com.capitalallocator.event.TradeProposalEvent;
import com.capitalallocator.guardrail.BlockRecordService;
import com.capitalallocator.guardrail.GuardrailConfig;
import com.capitalallocator.guardrail.GuardrailEvaluator;
import com.capitalallocator.guardrail.check.CatalystFreshnessCheck;
import com.capitalallocator.guardrail.check.EventWindowCheck;
import com.capitalallocator.guardrail.check.LiquidityCheck;
import com.capitalallocator.guardrail.check.PositionSizeRiskCheck;
import com.capitalallocator.guardrail.check.RegimeCheck;
import com.capitalallocator.guardrail.check.SectorExposureCheck;
import com.capitalallocator.ledger.AccountLockRegistry;
import com.capitalallocator.ledger.CapitalLedger;
import com.capitalallocator.ledger.LedgerConfig;
import com.capitalallocator.ledger.LedgerReplayer;
import com.capitalallocator.ledger.ReservationManager;
import com.capitalallocator.market.SnapshotMarketDataProvider;
import com.capitalallocator.observability.AllocationMetricsService;
import com.capitalallocator.repository.AccountRepository;
import com.capitalallocator.repository.CapitalTransactionRepository;
import com.capitalallocator.repository.KillSwitchRepository;
import com.capitalallocator.repository.MandateRepository;
import com.capitalallocator.repository.PositionRepository;
import com.capitalallocator.repository.ReservationRepository;
import com.capitalallocator.risk.KillSwitchConfig;
import com.capitalallocator.risk.KillSwitchMonitor;
import com.capitalallocator.sizing.PositionSizer;
import com.capitalallocator.sizing.PositionSizingConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.ApplicationEventPublisher;

/**
 * Wires the real allocator graph by hand, the way the Spring context would, with a controllable
 * clock and an event publisher that records what was published.
 */
public class AllocatorHarness implements AutoCloseable {

    public final MutableClock clock = new MutableClock(Fixtures.NOW, Fixtures.ZONE);
    public final List<Object> events = new CopyOnWriteArrayList<>();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final ExecutorService executor = Executors.newFixedThreadPool(4);

    public final LedgerConfig ledgerConfig = new LedgerConfig();
    public final RankingConfig rankingConfig = new RankingConfig();
    public final PositionSizingConfig positionSizingConfig = new PositionSizingConfig();
    public final GuardrailConfig guardrailConfig = new GuardrailConfig();
    public final AllocationConfig allocationConfig = new AllocationConfig();
    public final KillSwitchConfig killSwitchConfig = new KillSwitchConfig();

    public final AccountRepository accountRepository = new AccountRepository();
    public final MandateRepository mandateRepository = new MandateRepository(clock);
    public final PositionRepository positionRepository = new PositionRepository();
    public final CapitalTransactionRepository transactionRepository = new CapitalTransactionRepository();
    public final KillSwitchRepository killSwitchRepository = new KillSwitchRepository();
    public final ReservationRepository reservationRepository = new ReservationRepository();

    public final AccountLockRegistry lockRegistry = new AccountLockRegistry();
    public final AllocationMetricsService metricsService;
    public final EventPublisherHelper eventPublisherHelper;
    public final CapitalLedger capitalLedger;
    public final LedgerReplayer ledgerReplayer = new LedgerReplayer();
    public final ReservationManager reservationManager;
    public final SnapshotMarketDataProvider marketData = new SnapshotMarketDataProvider();
    public final PositionSizer positionSizer;
    public final GuardrailEvaluator guardrailEvaluator;
    public final BlockRecordService blockRecordService;
    public final TrancheReleaseService trancheReleaseService;
    public final AccountAllocator accountAllocator;
    public final AllocationEngine allocationEngine;
    public final AccountService accountService;
    public final PositionService positionService;
    public final KillSwitchMonitor killSwitchMonitor;

    public AllocatorHarness() {
        metricsService = new AllocationMetricsService(meterRegistry, reservationRepository);
        ApplicationEventPublisher publisher = event -> {
            events.add(event);
            if (event instanceof RiskEvent riskEvent) {
                metricsService.onRiskEvent(riskEvent);
            } else if (event instanceof TradeProposalEvent proposalEvent) {
                metricsService.onTradeProposal(proposalEvent);
            } else if (event instanceof BlockRecordEvent blockEvent) {
                metricsService.onBlockRecord(blockEvent);
            }
        };
        eventPublisherHelper = new EventPublisherHelper(publisher);

        capitalLedger = new CapitalLedger(
                accountRepository, transactionRepository, lockRegistry, eventPublisherHelper, clock);
        reservationManager = new ReservationManager(
                capitalLedger, reservationRepository, lockRegistry, ledgerConfig, eventPublisherHelper, clock);
        positionSizer = new PositionSizer(positionSizingConfig);
        guardrailEvaluator = new GuardrailEvaluator(
                List.of(
                        new LiquidityCheck(guardrailConfig),
                        new PositionSizeRiskCheck(),
                        new SectorExposureCheck(guardrailConfig),
                        new EventWindowCheck(guardrailConfig),
                        new RegimeCheck(),
                        new CatalystFreshnessCheck(guardrailConfig)),
                guardrailConfig,
                metricsService);
        blockRecordService = new BlockRecordService(eventPublisherHelper, clock);
        trancheReleaseService = new TrancheReleaseService(
                lockRegistry,
                accountRepository,
                mandateRepository,
                positionRepository,
                capitalLedger,
                reservationManager,
                marketData,
                positionSizer,
                guardrailEvaluator,
                blockRecordService,
                metricsService,
                eventPublisherHelper,
                clock);
        SnapshotValidator snapshotValidator = new SnapshotValidator();
        accountAllocator = new AccountAllocator(
                accountRepository,
                mandateRepository,
                positionRepository,
                lockRegistry,
                capitalLedger,
                reservationManager,
                marketData,
                snapshotValidator,
                new MandateFilter(),
                new PlaybookOverrideApplier(positionSizingConfig),
                new ObjectiveRanker(rankingConfig),
                positionSizer,
                guardrailEvaluator,
                blockRecordService,
                trancheReleaseService,
                allocationConfig,
                metricsService,
                eventPublisherHelper,
                clock);
        allocationEngine = new AllocationEngine(
                accountRepository, accountAllocator, eventPublisherHelper, allocationConfig, executor);
        accountService = new AccountService(
                accountRepository,
                mandateRepository,
                killSwitchRepository,
                capitalLedger,
                lockRegistry,
                snapshotValidator,
                killSwitchConfig);
        positionService = new PositionService(
                positionRepository, reservationManager, capitalLedger, lockRegistry, trancheReleaseService, clock);
        killSwitchMonitor = new KillSwitchMonitor(
                accountRepository, killSwitchRepository, lockRegistry, eventPublisherHelper, clock);
    }

    public <T> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    public List<RiskEvent> riskEvents(RiskEventType type) {
        return eventsOf(RiskEvent.class).stream()
                .filter(e -> e.getEventType() == type)
                .toList();
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
