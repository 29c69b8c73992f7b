package com.capitalallocator.observability;

import com.capitalallocator.domain.model.GuardrailResult;
import com.capitalallocator.domain.model.Reservation;
import com.capitalallocator.event.BlockRecordEvent;
import com.capitalallocator.event.RiskEvent;
import com.capitalallocator.event.RiskEventType;
import com.capitalallocator.event.TradeProposalEvent;
import com.capitalallocator.repository.ReservationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the allocator.
 *
 * <ul>
 *   <li><b>guardrail.evaluations.count</b> (counter): every guardrail evaluation</li>
 *   <li><b>guardrail.critical.count</b> (counter): evaluations with a CRITICAL outcome</li>
 *   <li><b>guardrail.evaluation.latency</b> (timer): time to run all six checks</li>
 *   <li><b>allocation.proposals.count</b> (counter): trade proposals emitted</li>
 *   <li><b>allocation.blocks.count</b> (counter): new block records opened</li>
 *   <li><b>allocation.insufficient_funds.count</b> (counter): reservations refused for cash</li>
 *   <li><b>ledger.reservations.expired.count</b> (counter): reservations released by TTL</li>
 *   <li><b>killswitch.trips.count</b> (counter): kill switches tripped</li>
 *   <li><b>ledger.reserved.total</b> (gauge): cash held by pending reservations</li>
 * </ul>
 *
 * <p>Direct calls cover the guardrail path; the rest are counted from application events.
 */
@Service
public class AllocationMetricsService {

    private final Counter guardrailEvaluationsCounter;
    private final Counter guardrailCriticalCounter;
    private final Counter proposalsCounter;
    private final Counter blocksCounter;
    private final Counter insufficientFundsCounter;
    private final Counter reservationsExpiredCounter;
    private final Counter killSwitchTripsCounter;
    private final Timer guardrailLatencyTimer;

    public AllocationMetricsService(MeterRegistry meterRegistry, ReservationRepository reservationRepository) {
        this.guardrailEvaluationsCounter = Counter.builder("guardrail.evaluations.count")
                .description("Guardrail evaluations run")
                .register(meterRegistry);

        this.guardrailCriticalCounter = Counter.builder("guardrail.critical.count")
                .description("Guardrail evaluations with at least one CRITICAL outcome")
                .register(meterRegistry);

        this.proposalsCounter = Counter.builder("allocation.proposals.count")
                .description("Trade proposals emitted with reserved cash")
                .register(meterRegistry);

        this.blocksCounter = Counter.builder("allocation.blocks.count")
                .description("Block records opened")
                .register(meterRegistry);

        this.insufficientFundsCounter = Counter.builder("allocation.insufficient_funds.count")
                .description("Reservations refused for insufficient available cash")
                .register(meterRegistry);

        this.reservationsExpiredCounter = Counter.builder("ledger.reservations.expired.count")
                .description("Pending reservations released after their TTL")
                .register(meterRegistry);

        this.killSwitchTripsCounter = Counter.builder("killswitch.trips.count")
                .description("Kill switches tripped")
                .register(meterRegistry);

        this.guardrailLatencyTimer = Timer.builder("guardrail.evaluation.latency")
                .description("Time to run all guardrail checks for one proposal")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(1))
                .register(meterRegistry);

        meterRegistry.gauge("ledger.reserved.total", reservationRepository, repository -> repository.findPending()
                .stream()
                .map(Reservation::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .doubleValue());
    }

    public void recordGuardrailEvaluation(GuardrailResult result, long durationNanos) {
        guardrailEvaluationsCounter.increment();
        if (result.isHasCriticalFailure()) {
            guardrailCriticalCounter.increment();
        }
        guardrailLatencyTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordInsufficientFunds() {
        insufficientFundsCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onTradeProposal(TradeProposalEvent event) {
        proposalsCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onBlockRecord(BlockRecordEvent event) {
        blocksCounter.increment();
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        if (event.getEventType() == RiskEventType.KILL_SWITCH_TRIPPED) {
            killSwitchTripsCounter.increment();
        } else if (event.getEventType() == RiskEventType.RESERVATION_EXPIRED) {
            reservationsExpiredCounter.increment();
        }
    }
}
