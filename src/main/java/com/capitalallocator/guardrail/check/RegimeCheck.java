package com.capitalallocator.guardrail.check;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import com.capitalallocator.domain.enums.Objective;
import com.capitalallocator.domain.enums.RegimeLevel;
import com.capitalallocator.domain.model.CheckResult;
import com.capitalallocator.domain.model.GuardrailWarning;
import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.guardrail.GuardrailCheck;
import com.capitalallocator.guardrail.GuardrailContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Warns when the symbol's volatility or liquidity regime does not suit the account's objective.
 *
 * <ul>
 *   <li>RISK_MINIMIZED: HIGH volatility or LOW liquidity</li>
 *   <li>BALANCED: HIGH volatility</li>
 *   <li>MAX_PROFIT: LOW liquidity</li>
 * </ul>
 * Missing regime labels are reported as INFO and pass.
 */
@Component
public class RegimeCheck implements GuardrailCheck {

    public static final String REGIME_INCOMPATIBLE = "REGIME_INCOMPATIBLE";
    public static final String REGIME_UNKNOWN = "REGIME_UNKNOWN";

    @Override
    public GuardrailCheckType getType() {
        return GuardrailCheckType.REGIME;
    }

    @Override
    public CheckResult evaluate(GuardrailContext context) {
        MarketSnapshot snapshot = context.getSnapshot();
        RegimeLevel volatility = snapshot.getVolatilityRegime();
        RegimeLevel liquidity = snapshot.getLiquidityRegime();
        if (volatility == null && liquidity == null) {
            return CheckResult.passWithInfo(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.INFO,
                            REGIME_UNKNOWN,
                            "No regime label available for " + snapshot.getSymbol()));
        }

        Objective objective = context.getAccount().getObjective();
        List<String> conflicts = new ArrayList<>();
        if (volatility == RegimeLevel.HIGH && objective != Objective.MAX_PROFIT) {
            conflicts.add("HIGH volatility");
        }
        if (liquidity == RegimeLevel.LOW && objective != Objective.BALANCED) {
            conflicts.add("LOW liquidity");
        }

        if (conflicts.isEmpty()) {
            return CheckResult.pass(getType());
        }

        Map<String, Object> details = new HashMap<>();
        details.put("objective", objective.name());
        details.put("volatilityRegime", volatility != null ? volatility.name() : "UNKNOWN");
        details.put("liquidityRegime", liquidity != null ? liquidity.name() : "UNKNOWN");
        return CheckResult.warning(
                getType(),
                GuardrailWarning.of(
                        GuardrailSeverity.WARNING,
                        REGIME_INCOMPATIBLE,
                        String.join(" and ", conflicts) + " regime does not suit a " + objective + " account",
                        details));
    }
}
