package com.capitalallocator.allocation;

import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.PlaybookOverride;
import com.capitalallocator.domain.model.PlaybookOverride.PriorityBoost;
import com.capitalallocator.domain.model.PlaybookOverride.StopTargetOverride;
import com.capitalallocator.domain.model.PlaybookOverride.TrancheSplit;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.domain.model.TrancheSpec;
import com.capitalallocator.sizing.PositionSizingConfig;
import com.capitalallocator.sizing.SizingParameters;
import java.math.BigDecimal;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Folds a signal's playbook overrides into the sizing parameters taken from the mandate.
 *
 * <p>Pure: the signal and mandate are not modified. Priority boosts multiply together; for stop
 * and target overrides and tranche splits the last one listed wins.
 */
@Component
public class PlaybookOverrideApplier {

    private static final List<TrancheSpec> SINGLE_LOT = List.of(new TrancheSpec(BigDecimal.valueOf(100), 0));

    private final PositionSizingConfig positionSizingConfig;

    public PlaybookOverrideApplier(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    public SizingParameters apply(Signal signal, Mandate mandate) {
        BigDecimal stopMultiple = mandate.getStopLossAtrMultiple() != null
                ? mandate.getStopLossAtrMultiple()
                : positionSizingConfig.getDefaultStopLossAtrMultiple();
        BigDecimal targetMultiple = mandate.getTakeProfitAtrMultiple() != null
                ? mandate.getTakeProfitAtrMultiple()
                : positionSizingConfig.getDefaultTakeProfitAtrMultiple();
        List<TrancheSpec> tranches = SINGLE_LOT;
        double boost = 1.0;

        for (PlaybookOverride override : signal.getOverrides()) {
            if (override instanceof PriorityBoost priorityBoost) {
                boost *= priorityBoost.factor();
            } else if (override instanceof StopTargetOverride stopTarget) {
                if (stopTarget.stopAtrMultiple() != null) {
                    stopMultiple = stopTarget.stopAtrMultiple();
                }
                if (stopTarget.takeProfitAtrMultiple() != null) {
                    targetMultiple = stopTarget.takeProfitAtrMultiple();
                }
            } else if (override instanceof TrancheSplit split) {
                tranches = split.tranches();
            }
        }

        return new SizingParameters(stopMultiple, targetMultiple, tranches, boost);
    }
}
