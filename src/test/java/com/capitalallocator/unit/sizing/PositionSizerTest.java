package com.capitalallocator.unit.sizing;

import static org.assertj.core.api.Assertions.assertThat;

import com.capitalallocator.domain.enums.Direction;
import com.capitalallocator.domain.enums.PositionSizeLimitType;
import com.capitalallocator.domain.enums.SizingConstraint;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.domain.model.Tranche;
import com.capitalallocator.domain.model.TrancheSpec;
import com.capitalallocator.sizing.PositionSizer;
import com.capitalallocator.sizing.PositionSizingConfig;
import com.capitalallocator.sizing.SizingParameters;
import com.capitalallocator.sizing.SizingRequest;
import com.capitalallocator.sizing.SizingResult;
import com.capitalallocator.support.Fixtures;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PositionSizer: the risk budget, mandate and Kelly caps, the cash cap on the
 * immediate tranche, and tranche splitting.
 */
class PositionSizerTest {

    private static final SizingParameters SINGLE_LOT = new SizingParameters(
            new BigDecimal("2"), new BigDecimal("4"), List.of(new TrancheSpec(new BigDecimal("100"), 0)), 1.0);

    private PositionSizer positionSizer;

    private final Account account = Fixtures.account("ACC-1").build();
    private final Mandate mandate = Fixtures.mandate("ACC-1").build();
    private final Signal signal = Fixtures.signal("S1", "RELIANCE").build();

    @BeforeEach
    void setUp() {
        positionSizer = new PositionSizer(new PositionSizingConfig());
    }

    private SizingResult size(Signal signal, Mandate mandate, String cash, SizingParameters parameters) {
        return positionSizer.size(SizingRequest.builder()
                .signal(signal)
                .account(account)
                .mandate(mandate)
                .entryPrice(new BigDecimal("2450"))
                .atr(new BigDecimal("50"))
                .deployableCash(new BigDecimal(cash))
                .parameters(parameters)
                .build());
    }

    @Nested
    @DisplayName("Worked example")
    class WorkedExample {

        @Test
        @DisplayName("1,00,000 at 2% risk, entry 2450, 2 ATR stop: 20 shares")
        void sizesTwentyShares() {
            SizingResult result = size(signal, mandate, "100000", SINGLE_LOT);

            assertThat(result.getQuantity()).isEqualTo(20);
            assertThat(result.getStopLoss()).isEqualByComparingTo("2350");
            assertThat(result.getTakeProfit()).isEqualByComparingTo("2650");
            assertThat(result.getStopDistance()).isEqualByComparingTo("100");
            assertThat(result.getRiskAmount()).isEqualByComparingTo("2000");
            assertThat(result.getNotional()).isEqualByComparingTo("49000");
            assertThat(result.getBindingConstraint()).isEqualTo(SizingConstraint.RISK_BUDGET);
        }

        @Test
        @DisplayName("SHORT puts the stop above and the target below entry")
        void shortLevels() {
            SizingResult result = size(
                    Fixtures.signal("S1", "RELIANCE").direction(Direction.SHORT).build(), mandate, "100000",
                    SINGLE_LOT);

            assertThat(result.getStopLoss()).isEqualByComparingTo("2550");
            assertThat(result.getTakeProfit()).isEqualByComparingTo("2250");
            assertThat(result.getQuantity()).isEqualTo(20);
        }

        @Test
        @DisplayName("Risk at stop never exceeds the mandate budget")
        void riskWithinBudget() {
            SizingResult result = size(signal, mandate, "100000", SINGLE_LOT);

            assertThat(result.getRiskAmount()).isLessThanOrEqualTo(new BigDecimal("2000"));
        }
    }

    @Nested
    @DisplayName("Caps")
    class Caps {

        @Test
        @DisplayName("Available cash caps the quantity")
        void cashCap() {
            SizingResult result = size(signal, mandate, "10000", SINGLE_LOT);

            assertThat(result.getQuantity()).isEqualTo(4);
            assertThat(result.getBindingConstraint()).isEqualTo(SizingConstraint.AVAILABLE_CASH);
        }

        @Test
        @DisplayName("No cash sizes to zero")
        void noCash() {
            SizingResult result = size(signal, mandate, "0", SINGLE_LOT);

            assertThat(result.isZero()).isTrue();
        }

        @Test
        @DisplayName("Absolute position cap binds")
        void absolutePositionCap() {
            Mandate capped = Fixtures.mandate("ACC-1")
                    .maxPositionSize(new BigDecimal("25000"))
                    .maxPositionSizeType(PositionSizeLimitType.AMOUNT)
                    .build();

            SizingResult result = size(signal, capped, "100000", SINGLE_LOT);

            assertThat(result.getQuantity()).isEqualTo(10);
            assertThat(result.getBindingConstraint()).isEqualTo(SizingConstraint.MAX_POSITION_SIZE);
        }

        @Test
        @DisplayName("Kelly cap binds for a weak signal")
        void kellyCap() {
            // 0.4 × 1% / 0.04 = 0.10 of capital = 10,000 → 4 shares
            Signal weak = Fixtures.signal("S1", "RELIANCE")
                    .confidence(0.4)
                    .edgeEstimate(new BigDecimal("1"))
                    .build();

            SizingResult result = size(weak, mandate, "100000", SINGLE_LOT);

            assertThat(result.getQuantity()).isEqualTo(4);
            assertThat(result.getBindingConstraint()).isEqualTo(SizingConstraint.KELLY_CAP);
        }

        @Test
        @DisplayName("Zero edge sizes to zero")
        void zeroEdge() {
            SizingResult result = size(
                    Fixtures.signal("S1", "RELIANCE").edgeEstimate(BigDecimal.ZERO).build(), mandate, "100000",
                    SINGLE_LOT);

            assertThat(result.getQuantity()).isZero();
        }

        @Test
        @DisplayName("A stop at or below zero cannot be sized")
        void invalidStop() {
            SizingParameters wide = new SizingParameters(
                    new BigDecimal("60"), new BigDecimal("4"), SINGLE_LOT.tranches(), 1.0);

            SizingResult result = size(signal, mandate, "100000", wide);

            assertThat(result.isZero()).isTrue();
            assertThat(result.getBindingConstraint()).isEqualTo(SizingConstraint.INVALID_STOP_DISTANCE);
        }

        @Test
        @DisplayName("Missing ATR falls back to a percent of price")
        void atrFallback() {
            SizingResult result = positionSizer.size(SizingRequest.builder()
                    .signal(signal)
                    .account(account)
                    .mandate(mandate)
                    .entryPrice(new BigDecimal("2450"))
                    .atr(null)
                    .deployableCash(new BigDecimal("100000"))
                    .parameters(SINGLE_LOT)
                    .build());

            // 2% of 2450 = 49 ATR, stop distance 98
            assertThat(result.getStopDistance()).isEqualByComparingTo("98");
            assertThat(result.getQuantity()).isEqualTo(20);
        }
    }

    @Nested
    @DisplayName("Monotonicity")
    class Monotonicity {

        @Test
        @DisplayName("More cash never shrinks the position")
        void moreCash_neverSmaller() {
            int previous = 0;
            for (int cash = 0; cash <= 100_000; cash += 5_000) {
                int quantity = size(signal, mandate, String.valueOf(cash), SINGLE_LOT).getQuantity();
                assertThat(quantity).isGreaterThanOrEqualTo(previous);
                previous = quantity;
            }
        }

        @Test
        @DisplayName("A wider stop never grows the position")
        void widerStop_neverLarger() {
            int previous = Integer.MAX_VALUE;
            for (int multiple = 1; multiple <= 10; multiple++) {
                SizingParameters parameters = new SizingParameters(
                        BigDecimal.valueOf(multiple), new BigDecimal("4"), SINGLE_LOT.tranches(), 1.0);
                int quantity = size(signal, mandate, "100000", parameters).getQuantity();
                assertThat(quantity).isLessThanOrEqualTo(previous);
                previous = quantity;
            }
        }

        @Test
        @DisplayName("A larger risk-per-trade limit never shrinks the position")
        void moreRisk_neverSmaller() {
            int first = -1;
            int previous = 0;
            for (BigDecimal risk = new BigDecimal("0.5");
                    risk.compareTo(BigDecimal.TEN) <= 0;
                    risk = risk.add(new BigDecimal("0.5"))) {
                Mandate riskier = Fixtures.mandate("ACC-1").maxRiskPerTradePercent(risk).build();
                int quantity = size(signal, riskier, "100000", SINGLE_LOT).getQuantity();
                assertThat(quantity).as("quantity at %s%% risk", risk).isGreaterThanOrEqualTo(previous);
                if (first < 0) {
                    first = quantity;
                }
                previous = quantity;
            }
            // 0.5% of 1,00,000 over a 100 stop is 5 shares; the caps take over well before 10%
            assertThat(first).isEqualTo(5);
            assertThat(previous).isGreaterThan(first);
        }
    }

    @Nested
    @DisplayName("Tranches")
    class Tranches {

        @Test
        @DisplayName("Split by percent with leftovers in the last tranche")
        void split() {
            SizingParameters staged = new SizingParameters(
                    new BigDecimal("2"),
                    new BigDecimal("4"),
                    List.of(
                            new TrancheSpec(new BigDecimal("33"), 0),
                            new TrancheSpec(new BigDecimal("33"), 2),
                            new TrancheSpec(new BigDecimal("34"), 5)),
                    1.0);

            SizingResult result = size(signal, mandate, "100000", staged);

            assertThat(result.getPlannedQuantity()).isEqualTo(20);
            assertThat(result.getTranches()).extracting(Tranche::quantity).containsExactly(6, 6, 8);
            assertThat(result.getQuantity()).isEqualTo(6);
            assertThat(result.getTranches().get(2).releaseCondition().delayDays()).isEqualTo(5);
            assertThat(result.getTranches().get(0).isImmediate()).isTrue();
        }

        @Test
        @DisplayName("Cash only caps the immediate tranche")
        void cashCapsFirstTrancheOnly() {
            SizingParameters staged = new SizingParameters(
                    new BigDecimal("2"),
                    new BigDecimal("4"),
                    List.of(new TrancheSpec(new BigDecimal("50"), 0), new TrancheSpec(new BigDecimal("50"), 3)),
                    1.0);

            SizingResult result = size(signal, mandate, "5000", staged);

            assertThat(result.getTranches()).extracting(Tranche::quantity).containsExactly(2, 10);
            assertThat(result.getQuantity()).isEqualTo(2);
            assertThat(result.getBindingConstraint()).isEqualTo(SizingConstraint.AVAILABLE_CASH);
        }
    }
}
