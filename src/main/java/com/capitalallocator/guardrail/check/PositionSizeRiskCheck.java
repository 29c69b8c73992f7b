package com.capitalallocator.guardrail.check;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import com.capitalallocator.domain.model.CheckResult;
import com.capitalallocator.domain.model.GuardrailWarning;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.guardrail.GuardrailCheck;
import com.capitalallocator.guardrail.GuardrailContext;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Loss at the stop ({@code quantity × |entry − stop|}) may not exceed the mandate's max risk per
 * trade as a percent of total capital.
 */
@Component
public class PositionSizeRiskCheck implements GuardrailCheck {

    public static final String POSITION_SIZE_EXCEEDED = "POSITION_SIZE_EXCEEDED";

    @Override
    public GuardrailCheckType getType() {
        return GuardrailCheckType.POSITION_SIZE;
    }

    @Override
    public CheckResult evaluate(GuardrailContext context) {
        BigDecimal stopDistance = context.getEntryPrice().subtract(context.getStopLoss()).abs();
        BigDecimal riskAtStop = Money.of(stopDistance.multiply(BigDecimal.valueOf(context.getQuantity())));
        BigDecimal maxRisk = Money.percentOf(
                context.getMandate().getMaxRiskPerTradePercent(), context.getAccount().getTotalCapital());

        if (riskAtStop.compareTo(maxRisk) > 0) {
            return CheckResult.critical(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.CRITICAL,
                            POSITION_SIZE_EXCEEDED,
                            "Risk at stop " + riskAtStop + " exceeds per-trade limit " + maxRisk,
                            Map.of("riskAtStop", riskAtStop, "maxRisk", maxRisk)));
        }
        return CheckResult.pass(getType());
    }
}
