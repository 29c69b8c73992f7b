package com.capitalallocator.risk;

import com.capitalallocator.domain.enums.KillSwitchKind;
import com.capitalallocator.domain.enums.ThresholdType;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.KillSwitch;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.PnlUpdate;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.event.PnlUpdateEvent;
import com.capitalallocator.event.RiskEventType;
import com.capitalallocator.event.RiskLevel;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.ledger.AccountLockRegistry;
import com.capitalallocator.repository.AccountRepository;
import com.capitalallocator.repository.KillSwitchRepository;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Evaluates every account's kill switches on each P&L update and pauses the account on a breach.
 *
 * <p>Per account it tracks the realized P&L of the current trading day (replaced when a new
 * trading date arrives), the unrealized P&L, equity ({@code totalCapital + booked realized P&L +
 * unrealized}), peak equity and drawdown. Peak equity moves with contributed capital, so a
 * withdrawal or transfer out is not read as a drawdown. MAX_DAILY_LOSS watches the daily realized P&L and
 * MAX_DRAWDOWN the drawdown; a switch trips when the metric is at or below its threshold.
 *
 * <p>Trips are sticky. Only {@link #reset} clears them and un-pauses the account. Open positions
 * are left alone: a tripped switch stops new entries, it does not liquidate.
 */
@Service
public class KillSwitchMonitor {

    private static final Logger log = LoggerFactory.getLogger(KillSwitchMonitor.class);

    private final AccountRepository accountRepository;
    private final KillSwitchRepository killSwitchRepository;
    private final AccountLockRegistry lockRegistry;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final Map<String, AccountRiskState> riskStates = new ConcurrentHashMap<>();

    public KillSwitchMonitor(
            AccountRepository accountRepository,
            KillSwitchRepository killSwitchRepository,
            AccountLockRegistry lockRegistry,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.accountRepository = accountRepository;
        this.killSwitchRepository = killSwitchRepository;
        this.lockRegistry = lockRegistry;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ========================
    // P&L UPDATES
    // ========================

    @EventListener
    public void onPnlUpdateEvent(PnlUpdateEvent event) {
        onPnlUpdate(event.getUpdate());
    }

    /**
     * Applies one P&L update and trips any switch it breaches.
     *
     * @return switches tripped by this update (empty when none)
     */
    public List<KillSwitch> onPnlUpdate(PnlUpdate update) {
        String accountId = update.getAccountId();
        return lockRegistry.withLock(accountId, () -> {
            Account account = accountRepository
                    .findById(accountId)
                    .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));

            AccountRiskState previous = riskStates.get(accountId);
            if (previous != null
                    && update.getTradingDate() != null
                    && update.getTradingDate().isBefore(previous.tradingDate())) {
                log.debug("Ignoring P&L update for {} dated {} (tracking {})", accountId, update.getTradingDate(),
                        previous.tradingDate());
                return List.<KillSwitch>of();
            }

            AccountRiskState state = nextState(account, previous, update);
            riskStates.put(accountId, state);

            List<KillSwitch> tripped = killSwitchRepository.findByAccount(accountId).stream()
                    .filter(s -> !s.isTripped())
                    .filter(s -> isBreached(s, state, account.getTotalCapital()))
                    .toList();
            if (tripped.isEmpty()) {
                return tripped;
            }

            LocalDateTime now = LocalDateTime.now(clock);
            for (KillSwitch killSwitch : tripped) {
                killSwitch.setTripped(true);
                killSwitch.setTrippedAt(now);
                killSwitch.setTrippedValue(metricValue(killSwitch, state, account.getTotalCapital()));
                killSwitchRepository.save(killSwitch);
            }
            account.setPaused(true);
            accountRepository.save(account);

            for (KillSwitch killSwitch : tripped) {
                log.error(
                        "KILL SWITCH TRIPPED: account {} {} at {} (threshold {} {})",
                        accountId,
                        killSwitch.getKind(),
                        killSwitch.getTrippedValue(),
                        killSwitch.getThreshold(),
                        killSwitch.getThresholdType());
                eventPublisherHelper.publishRiskEvent(
                        this,
                        accountId,
                        RiskEventType.KILL_SWITCH_TRIPPED,
                        RiskLevel.CRITICAL,
                        killSwitch.getKind() + " breached for account " + accountId,
                        Map.of(
                                "kind", killSwitch.getKind().name(),
                                "value", killSwitch.getTrippedValue(),
                                "threshold", killSwitch.getThreshold(),
                                "thresholdType", killSwitch.getThresholdType().name()));
            }
            return tripped;
        });
    }

    // ========================
    // MANUAL RESET
    // ========================

    /**
     * Clears every tripped switch on the account and un-pauses it. The drawdown peak is
     * re-based to current equity so the breach that was just reviewed does not re-trip at once.
     */
    public void reset(String accountId, String resetBy) {
        lockRegistry.withLock(accountId, () -> {
            Account account = accountRepository
                    .findById(accountId)
                    .orElseThrow(() -> new ResourceNotFoundException("Account", accountId));

            for (KillSwitch killSwitch : killSwitchRepository.findByAccount(accountId)) {
                if (killSwitch.isTripped()) {
                    killSwitch.setTripped(false);
                    killSwitch.setTrippedAt(null);
                    killSwitch.setTrippedValue(null);
                    killSwitchRepository.save(killSwitch);
                }
            }
            account.setPaused(false);
            accountRepository.save(account);

            riskStates.computeIfPresent(accountId, (id, state) -> new AccountRiskState(
                    id,
                    state.tradingDate(),
                    state.dailyRealizedPnl(),
                    state.unrealizedPnl(),
                    state.equity(),
                    state.capitalBase(),
                    state.equity(),
                    Money.of(BigDecimal.ZERO)));

            log.warn("Kill switches reset for account {} by {}", accountId, resetBy);
            eventPublisherHelper.publishRiskEvent(
                    this,
                    accountId,
                    RiskEventType.KILL_SWITCH_RESET,
                    RiskLevel.INFO,
                    "Kill switches reset for account " + accountId,
                    Map.of("resetBy", resetBy));
        });
    }

    public Optional<AccountRiskState> getRiskState(String accountId) {
        return Optional.ofNullable(riskStates.get(accountId));
    }

    public boolean isPaused(String accountId) {
        return accountRepository.findById(accountId).map(Account::isPaused).orElse(false);
    }

    // ========================
    // INTERNALS
    // ========================

    private AccountRiskState nextState(Account account, AccountRiskState previous, PnlUpdate update) {
        BigDecimal daily = Money.of(update.getRealizedDailyPnl());
        BigDecimal unrealized = Money.of(update.getUnrealizedPnl());
        BigDecimal equity = Money.of(account.getTotalCapital().add(account.getRealizedPnl()).add(unrealized));

        BigDecimal capitalBase = Money.of(account.getTotalCapital());
        BigDecimal peak = capitalBase;
        if (previous != null) {
            // Deposits, SIP installments and transfers move equity without any trading result
            peak = previous.peakEquity().add(capitalBase.subtract(previous.capitalBase()));
        }
        peak = peak.max(equity);

        LocalDate tradingDate = update.getTradingDate() != null ? update.getTradingDate() : LocalDate.now(clock);
        if (previous != null && !previous.tradingDate().equals(tradingDate)) {
            log.debug("New trading date {} for account {}, daily P&L restarted", tradingDate, account.getId());
        }

        return new AccountRiskState(
                account.getId(), tradingDate, daily, unrealized, equity, capitalBase, peak, equity.subtract(peak));
    }

    private static boolean isBreached(KillSwitch killSwitch, AccountRiskState state, BigDecimal totalCapital) {
        BigDecimal value = metricValue(killSwitch, state, totalCapital);
        return value != null && value.compareTo(killSwitch.getThreshold()) <= 0;
    }

    /** Monitored metric in the switch's threshold units; null when a percent cannot be computed. */
    private static BigDecimal metricValue(KillSwitch killSwitch, AccountRiskState state, BigDecimal totalCapital) {
        BigDecimal raw = killSwitch.getKind() == KillSwitchKind.MAX_DAILY_LOSS
                ? state.dailyRealizedPnl()
                : state.drawdown();
        if (killSwitch.getThresholdType() == ThresholdType.ABSOLUTE) {
            return raw;
        }
        if (totalCapital.signum() <= 0) {
            return null;
        }
        return raw.multiply(Money.HUNDRED).divide(totalCapital, 4, RoundingMode.HALF_UP);
    }
}
