package com.capitalallocator.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.capitalallocator.domain.enums.KillSwitchKind;
import com.capitalallocator.domain.enums.ThresholdType;
import com.capitalallocator.domain.model.KillSwitch;
import com.capitalallocator.domain.model.PnlUpdate;
import com.capitalallocator.event.EventPublisherHelper;
import com.capitalallocator.event.RiskEventType;
import com.capitalallocator.event.RiskLevel;
import com.capitalallocator.exception.ResourceNotFoundException;
import com.capitalallocator.ledger.AccountLockRegistry;
import com.capitalallocator.repository.AccountRepository;
import com.capitalallocator.repository.KillSwitchRepository;
import com.capitalallocator.risk.AccountRiskState;
import com.capitalallocator.risk.KillSwitchMonitor;
import com.capitalallocator.support.Fixtures;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for KillSwitchMonitor: daily loss and drawdown thresholds in absolute and percent
 * terms, sticky trips, stale updates and manual reset.
 */
@ExtendWith(MockitoExtension.class)
class KillSwitchMonitorTest {

    private static final String ACCOUNT = "ACC-1";
    private static final LocalDate TODAY = Fixtures.NOW.toLocalDate();

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private AccountRepository accountRepository;
    private KillSwitchRepository killSwitchRepository;
    private KillSwitchMonitor killSwitchMonitor;

    @BeforeEach
    void setUp() {
        accountRepository = new AccountRepository();
        killSwitchRepository = new KillSwitchRepository();
        Clock clock = Clock.fixed(Fixtures.NOW.atZone(Fixtures.ZONE).toInstant(), Fixtures.ZONE);
        killSwitchMonitor = new KillSwitchMonitor(
                accountRepository, killSwitchRepository, new AccountLockRegistry(), eventPublisherHelper, clock);

        accountRepository.save(Fixtures.account(ACCOUNT).build());
    }

    private void addSwitch(KillSwitchKind kind, String threshold, ThresholdType type) {
        killSwitchRepository.save(KillSwitch.builder()
                .id(kind.name())
                .accountId(ACCOUNT)
                .kind(kind)
                .threshold(new BigDecimal(threshold))
                .thresholdType(type)
                .build());
    }

    private List<KillSwitch> update(LocalDate date, String daily, String unrealized) {
        return killSwitchMonitor.onPnlUpdate(PnlUpdate.builder()
                .accountId(ACCOUNT)
                .tradingDate(date)
                .realizedDailyPnl(new BigDecimal(daily))
                .unrealizedPnl(new BigDecimal(unrealized))
                .timestamp(Fixtures.NOW)
                .build());
    }

    // ========================
    // DAILY LOSS
    // ========================

    @Nested
    @DisplayName("Daily loss")
    class DailyLoss {

        @Test
        @DisplayName("Absolute threshold trips and pauses the account")
        void absolute_trips() {
            addSwitch(KillSwitchKind.MAX_DAILY_LOSS, "-5000", ThresholdType.ABSOLUTE);

            List<KillSwitch> tripped = update(TODAY, "-6000", "0");

            assertThat(tripped).hasSize(1);
            assertThat(tripped.get(0).getTrippedValue()).isEqualByComparingTo("-6000");
            assertThat(killSwitchMonitor.isPaused(ACCOUNT)).isTrue();
            assertThat(killSwitchRepository.findByAccount(ACCOUNT).get(0).isTripped()).isTrue();
            verify(eventPublisherHelper)
                    .publishRiskEvent(
                            any(),
                            eq(ACCOUNT),
                            eq(RiskEventType.KILL_SWITCH_TRIPPED),
                            eq(RiskLevel.CRITICAL),
                            anyString(),
                            anyMap());
        }

        @Test
        @DisplayName("Loss above the floor leaves the account running")
        void absolute_notBreached() {
            addSwitch(KillSwitchKind.MAX_DAILY_LOSS, "-5000", ThresholdType.ABSOLUTE);

            assertThat(update(TODAY, "-4999.99", "0")).isEmpty();
            assertThat(killSwitchMonitor.isPaused(ACCOUNT)).isFalse();
            verify(eventPublisherHelper, never())
                    .publishRiskEvent(any(), anyString(), any(), any(), anyString(), anyMap());
        }

        @Test
        @DisplayName("Percent threshold is measured against total capital and trips at equality")
        void percent_tripsAtEquality() {
            addSwitch(KillSwitchKind.MAX_DAILY_LOSS, "-5", ThresholdType.PERCENT_OF_CAPITAL);

            assertThat(update(TODAY, "-4000", "0")).isEmpty();
            List<KillSwitch> tripped = update(TODAY, "-5000", "0");

            assertThat(tripped).hasSize(1);
            assertThat(tripped.get(0).getTrippedValue()).isEqualByComparingTo("-5");
        }

        @Test
        @DisplayName("An update for an earlier trading date is ignored")
        void staleDate_ignored() {
            addSwitch(KillSwitchKind.MAX_DAILY_LOSS, "-5000", ThresholdType.ABSOLUTE);
            update(TODAY, "0", "0");

            assertThat(update(TODAY.minusDays(1), "-6000", "0")).isEmpty();
            assertThat(killSwitchMonitor.isPaused(ACCOUNT)).isFalse();
            assertThat(killSwitchMonitor.getRiskState(ACCOUNT).orElseThrow().tradingDate()).isEqualTo(TODAY);
        }
    }

    // ========================
    // DRAWDOWN
    // ========================

    @Nested
    @DisplayName("Drawdown")
    class Drawdown {

        @Test
        @DisplayName("Drawdown is measured from peak equity, not starting capital")
        void drawdownFromPeak() {
            addSwitch(KillSwitchKind.MAX_DRAWDOWN, "-10000", ThresholdType.ABSOLUTE);

            update(TODAY, "0", "5000");
            AccountRiskState peak = killSwitchMonitor.getRiskState(ACCOUNT).orElseThrow();
            assertThat(peak.peakEquity()).isEqualByComparingTo("105000");

            // 5500 below starting capital but 10500 below the peak
            List<KillSwitch> tripped = update(TODAY, "0", "-5500");

            assertThat(tripped).extracting(KillSwitch::getKind).containsExactly(KillSwitchKind.MAX_DRAWDOWN);
            assertThat(killSwitchMonitor.getRiskState(ACCOUNT).orElseThrow().drawdown())
                    .isEqualByComparingTo("-10500");
        }

        @Test
        @DisplayName("Trips are sticky across recovering updates")
        void sticky() {
            addSwitch(KillSwitchKind.MAX_DRAWDOWN, "-10", ThresholdType.PERCENT_OF_CAPITAL);
            assertThat(update(TODAY, "0", "-12000")).hasSize(1);

            assertThat(update(TODAY, "0", "2000")).isEmpty();

            assertThat(killSwitchMonitor.isPaused(ACCOUNT)).isTrue();
            assertThat(killSwitchRepository.findByAccount(ACCOUNT).get(0).isTripped()).isTrue();
        }

        @Test
        @DisplayName("Capital flows move the peak without changing the drawdown")
        void capitalFlowsShiftPeak() {
            addSwitch(KillSwitchKind.MAX_DRAWDOWN, "-10000", ThresholdType.ABSOLUTE);
            update(TODAY, "0", "-5000");

            accountRepository.save(Fixtures.account(ACCOUNT)
                    .totalCapital(new BigDecimal("150000.00"))
                    .availableCash(new BigDecimal("150000.00"))
                    .build());
            update(TODAY, "0", "-5000");

            AccountRiskState afterDeposit = killSwitchMonitor.getRiskState(ACCOUNT).orElseThrow();
            assertThat(afterDeposit.peakEquity()).isEqualByComparingTo("150000");
            assertThat(afterDeposit.drawdown()).isEqualByComparingTo("-5000");

            accountRepository.save(Fixtures.account(ACCOUNT)
                    .totalCapital(new BigDecimal("40000.00"))
                    .availableCash(new BigDecimal("40000.00"))
                    .build());

            assertThat(update(TODAY, "0", "-5000")).isEmpty();
            AccountRiskState afterWithdrawal = killSwitchMonitor.getRiskState(ACCOUNT).orElseThrow();
            assertThat(afterWithdrawal.peakEquity()).isEqualByComparingTo("40000");
            assertThat(afterWithdrawal.drawdown()).isEqualByComparingTo("-5000");
            assertThat(killSwitchMonitor.isPaused(ACCOUNT)).isFalse();
        }
    }

    // ========================
    // RESET
    // ========================

    @Nested
    @DisplayName("Reset")
    class Reset {

        @Test
        @DisplayName("Reset clears trips, unpauses and re-bases the drawdown peak")
        void reset_rebases() {
            addSwitch(KillSwitchKind.MAX_DRAWDOWN, "-10000", ThresholdType.ABSOLUTE);
            update(TODAY, "0", "-12000");

            killSwitchMonitor.reset(ACCOUNT, "risk-desk");

            assertThat(killSwitchMonitor.isPaused(ACCOUNT)).isFalse();
            KillSwitch killSwitch = killSwitchRepository.findByAccount(ACCOUNT).get(0);
            assertThat(killSwitch.isTripped()).isFalse();
            assertThat(killSwitch.getTrippedValue()).isNull();
            AccountRiskState state = killSwitchMonitor.getRiskState(ACCOUNT).orElseThrow();
            assertThat(state.drawdown()).isEqualByComparingTo("0");
            assertThat(state.peakEquity()).isEqualByComparingTo("88000");

            // Same mark again does not re-trip after the re-base
            assertThat(update(TODAY, "0", "-12000")).isEmpty();
            verify(eventPublisherHelper)
                    .publishRiskEvent(
                            any(),
                            eq(ACCOUNT),
                            eq(RiskEventType.KILL_SWITCH_RESET),
                            eq(RiskLevel.INFO),
                            anyString(),
                            anyMap());
        }

        @Test
        @DisplayName("Unknown account is rejected")
        void unknownAccount() {
            assertThatThrownBy(() -> killSwitchMonitor.reset("missing", "risk-desk"))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }
}
