package com.capitalallocator.unit.allocation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.capitalallocator.allocation.PlaybookOverrideApplier;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.PlaybookOverride.PriorityBoost;
import com.capitalallocator.domain.model.PlaybookOverride.StopTargetOverride;
import com.capitalallocator.domain.model.PlaybookOverride.TrancheSplit;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.domain.model.TrancheSpec;
import com.capitalallocator.sizing.PositionSizingConfig;
import com.capitalallocator.sizing.SizingParameters;
import com.capitalallocator.support.Fixtures;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PlaybookOverrideApplierTest {

    private final PlaybookOverrideApplier applier = new PlaybookOverrideApplier(new PositionSizingConfig());

    @Test
    @DisplayName("Without overrides the mandate multiples and a single lot apply")
    void noOverrides() {
        SizingParameters parameters =
                applier.apply(Fixtures.signal("S1", "INFY").build(), Fixtures.mandate("ACC-1").build());

        assertThat(parameters.stopAtrMultiple()).isEqualByComparingTo("2");
        assertThat(parameters.takeProfitAtrMultiple()).isEqualByComparingTo("4");
        assertThat(parameters.tranches()).hasSize(1);
        assertThat(parameters.tranches().get(0).percent()).isEqualByComparingTo("100");
        assertThat(parameters.priorityBoost()).isEqualTo(1.0);
        assertThat(parameters.isStaged()).isFalse();
    }

    @Test
    @DisplayName("Missing mandate multiples fall back to configured defaults")
    void mandateDefaults() {
        Mandate mandate = Fixtures.mandate("ACC-1")
                .stopLossAtrMultiple(null)
                .takeProfitAtrMultiple(null)
                .build();

        SizingParameters parameters = applier.apply(Fixtures.signal("S1", "INFY").build(), mandate);

        assertThat(parameters.stopAtrMultiple()).isEqualByComparingTo("2.0");
        assertThat(parameters.takeProfitAtrMultiple()).isEqualByComparingTo("4.0");
    }

    @Test
    @DisplayName("Boosts multiply; last stop/target and last split win")
    void combinesOverrides() {
        Signal signal = Fixtures.signal("S1", "INFY")
                .overrides(List.of(
                        new PriorityBoost(1.5),
                        new StopTargetOverride(new BigDecimal("1.5"), null),
                        new TrancheSplit(List.of(new TrancheSpec(new BigDecimal("100"), 0))),
                        new PriorityBoost(2.0),
                        new StopTargetOverride(null, new BigDecimal("6")),
                        new TrancheSplit(List.of(
                                new TrancheSpec(new BigDecimal("50"), 0), new TrancheSpec(new BigDecimal("50"), 3)))))
                .build();

        SizingParameters parameters = applier.apply(signal, Fixtures.mandate("ACC-1").build());

        assertThat(parameters.priorityBoost()).isEqualTo(3.0);
        assertThat(parameters.stopAtrMultiple()).isEqualByComparingTo("1.5");
        assertThat(parameters.takeProfitAtrMultiple()).isEqualByComparingTo("6");
        assertThat(parameters.tranches()).extracting(TrancheSpec::delayDays).containsExactly(0, 3);
        assertThat(parameters.isStaged()).isTrue();
    }

    @Test
    @DisplayName("Malformed overrides are rejected when built")
    void malformedOverrides() {
        assertThatThrownBy(() -> new PriorityBoost(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TrancheSplit(List.of(new TrancheSpec(new BigDecimal("60"), 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TrancheSpec(new BigDecimal("50"), -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
