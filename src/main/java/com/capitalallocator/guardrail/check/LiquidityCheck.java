package com.capitalallocator.guardrail.check;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import com.capitalallocator.domain.model.CheckResult;
import com.capitalallocator.domain.model.GuardrailWarning;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.guardrail.GuardrailCheck;
import com.capitalallocator.guardrail.GuardrailConfig;
import com.capitalallocator.guardrail.GuardrailContext;
import java.math.BigDecimal;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * A trade's notional may not exceed {@code maxTradeToAdvRatio} of the symbol's 20-day average
 * daily traded value. No ADV data is a WARNING, since liquidity cannot be confirmed either way.
 */
@Component
public class LiquidityCheck implements GuardrailCheck {

    public static final String LIQUIDITY_BELOW_THRESHOLD = "LIQUIDITY_BELOW_THRESHOLD";
    public static final String INSUFFICIENT_VOLUME_DATA = "INSUFFICIENT_VOLUME_DATA";

    private final GuardrailConfig guardrailConfig;

    public LiquidityCheck(GuardrailConfig guardrailConfig) {
        this.guardrailConfig = guardrailConfig;
    }

    @Override
    public GuardrailCheckType getType() {
        return GuardrailCheckType.LIQUIDITY;
    }

    @Override
    public CheckResult evaluate(GuardrailContext context) {
        BigDecimal adv = context.getSnapshot().getAverageDailyValue20();
        if (adv == null || adv.signum() <= 0) {
            return CheckResult.warning(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.WARNING,
                            INSUFFICIENT_VOLUME_DATA,
                            "No average daily value available for " + context.getSignal().getSymbol(),
                            Map.of("lookbackDays", guardrailConfig.getAdvLookbackDays())));
        }

        BigDecimal notional = context.getNotional();
        BigDecimal limit = Money.of(adv.multiply(guardrailConfig.getMaxTradeToAdvRatio()));
        if (notional.compareTo(limit) > 0) {
            return CheckResult.critical(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.CRITICAL,
                            LIQUIDITY_BELOW_THRESHOLD,
                            "Trade value " + notional + " exceeds " + limit + " ("
                                    + guardrailConfig.getMaxTradeToAdvRatio() + " of ADV " + adv + ")",
                            Map.of("notional", notional, "limit", limit, "adv", adv)));
        }
        return CheckResult.pass(getType());
    }
}
