package com.capitalallocator.unit.allocation;

import static org.assertj.core.api.Assertions.assertThat;

import com.capitalallocator.allocation.MandateCheck;
import com.capitalallocator.allocation.MandateFilter;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.support.Fixtures;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MandateFilterTest {

    private final MandateFilter mandateFilter = new MandateFilter();
    private final Account account = Fixtures.account("ACC-1").build();

    @Nested
    @DisplayName("Horizon")
    class Horizon {

        @Test
        @DisplayName("Horizon bounds are inclusive")
        void bounds_inclusive() {
            Mandate mandate = Fixtures.mandate("ACC-1").minHorizonDays(5).maxHorizonDays(20).build();

            assertThat(mandateFilter.eligible(Fixtures.signal("S1", "INFY").horizonDays(5).build(), mandate, account))
                    .isTrue();
            assertThat(mandateFilter.eligible(Fixtures.signal("S2", "INFY").horizonDays(20).build(), mandate, account))
                    .isTrue();
        }

        @Test
        @DisplayName("Horizon outside the range is rejected")
        void outside_rejected() {
            Mandate mandate = Fixtures.mandate("ACC-1").minHorizonDays(5).maxHorizonDays(20).build();

            MandateCheck check =
                    mandateFilter.evaluate(Fixtures.signal("S1", "INFY").horizonDays(21).build(), mandate, account);

            assertThat(check.isEligible()).isFalse();
            assertThat(check.getReasons()).containsExactly(MandateCheck.HORIZON_OUT_OF_RANGE);
        }
    }

    @Nested
    @DisplayName("Sector and strategy")
    class SectorAndStrategy {

        @Test
        @DisplayName("Empty allow-lists accept anything")
        void emptyLists_unrestricted() {
            Signal signal = Fixtures.signal("S1", "INFY").sector("ANYTHING").strategy("WHATEVER").build();

            assertThat(mandateFilter.eligible(signal, Fixtures.mandate("ACC-1").build(), account)).isTrue();
        }

        @Test
        @DisplayName("Sector match ignores case")
        void sector_caseInsensitive() {
            Mandate mandate = Fixtures.mandate("ACC-1").allowedSectors(Set.of("Energy")).build();

            assertThat(mandateFilter.eligible(Fixtures.signal("S1", "RELIANCE").sector("ENERGY").build(), mandate,
                            account))
                    .isTrue();
        }

        @Test
        @DisplayName("Every broken rule is reported")
        void allReasons() {
            Mandate mandate = Fixtures.mandate("ACC-1")
                    .allowedSectors(Set.of("IT"))
                    .allowedStrategies(Set.of("MEAN_REVERSION"))
                    .build();
            Signal signal = Fixtures.signal("S1", "RELIANCE").horizonDays(90).build();

            MandateCheck check = mandateFilter.evaluate(signal, mandate, account);

            assertThat(check.getReasons())
                    .containsExactly(
                            MandateCheck.HORIZON_OUT_OF_RANGE,
                            MandateCheck.SECTOR_NOT_ALLOWED,
                            MandateCheck.STRATEGY_NOT_ALLOWED);
        }

        @Test
        @DisplayName("A missing sector fails a restricted mandate")
        void nullSector_restricted() {
            Mandate mandate = Fixtures.mandate("ACC-1").allowedSectors(Set.of("IT")).build();

            assertThat(mandateFilter.eligible(Fixtures.signal("S1", "X").sector(null).build(), mandate, account))
                    .isFalse();
        }
    }

    @Test
    @DisplayName("A paused account rejects every signal")
    void pausedAccount() {
        Account paused = Fixtures.account("ACC-1").paused(true).build();

        MandateCheck check =
                mandateFilter.evaluate(Fixtures.signal("S1", "INFY").build(), Fixtures.mandate("ACC-1").build(), paused);

        assertThat(check.isEligible()).isFalse();
        assertThat(check.isPaused()).isTrue();
    }
}
