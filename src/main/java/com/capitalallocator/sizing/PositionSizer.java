package com.capitalallocator.sizing;

import com.capitalallocator.domain.enums.Direction;
import com.capitalallocator.domain.enums.PositionSizeLimitType;
import com.capitalallocator.domain.enums.SizingConstraint;
import com.capitalallocator.domain.model.Account;
import com.capitalallocator.domain.model.Mandate;
import com.capitalallocator.domain.model.Money;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.domain.model.Tranche;
import com.capitalallocator.domain.model.TrancheReleaseCondition;
import com.capitalallocator.domain.model.TrancheSpec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a ranked signal and the account's deployable cash into a share quantity.
 *
 * <p>Quantity is the minimum of four caps, floored at zero:
 * <ol>
 *   <li>risk budget: {@code maxRiskPerTrade% × totalCapital / |entry − stop|}</li>
 *   <li>mandate max position size (an amount, or a percent of total capital) / entry</li>
 *   <li>Kelly-lite: {@code clamp(confidence × edge / assumedVariance, 0, kellyCap) × totalCapital / entry}</li>
 *   <li>deployable cash / entry</li>
 * </ol>
 * Stops and targets sit {@code ATR × multiple} from entry, on the side set by the direction.
 * Without an ATR the sizer assumes {@code defaultAtrPercent} of price.
 *
 * <p>A tranche split divides the quantity allowed by the first three caps. Only the first
 * tranche is capped by cash now; later tranches are re-checked against the ledger on release.
 */
@Component
public class PositionSizer {

    private static final Logger log = LoggerFactory.getLogger(PositionSizer.class);

    private final PositionSizingConfig positionSizingConfig;

    public PositionSizer(PositionSizingConfig positionSizingConfig) {
        this.positionSizingConfig = positionSizingConfig;
    }

    public SizingResult size(SizingRequest request) {
        Signal signal = request.getSignal();
        Account account = request.getAccount();
        Mandate mandate = request.getMandate();
        SizingParameters parameters = request.getParameters();
        BigDecimal entry = Money.of(request.getEntryPrice());
        BigDecimal totalCapital = account.getTotalCapital();

        BigDecimal atr = effectiveAtr(request.getAtr(), entry);
        BigDecimal stopOffset = Money.of(atr.multiply(parameters.stopAtrMultiple()));
        BigDecimal targetOffset = Money.of(atr.multiply(parameters.takeProfitAtrMultiple()));
        boolean isLong = signal.getDirection() == Direction.LONG;
        BigDecimal stop = isLong ? entry.subtract(stopOffset) : entry.add(stopOffset);
        BigDecimal target = isLong ? entry.add(targetOffset) : entry.subtract(targetOffset);
        BigDecimal stopDistance = entry.subtract(stop).abs();

        if (entry.signum() <= 0 || stopDistance.signum() <= 0 || (isLong && stop.signum() <= 0)) {
            log.warn("Cannot size {} for account {}: entry={}, stop={}", signal.getSymbol(), account.getId(), entry,
                    stop);
            return zero(entry, stop, target, stopDistance, SizingConstraint.INVALID_STOP_DISTANCE);
        }

        // Risk budget
        BigDecimal riskBudget = Money.percentOf(mandate.getMaxRiskPerTradePercent(), totalCapital);
        int planned = floorDiv(riskBudget, stopDistance);
        SizingConstraint binding = SizingConstraint.RISK_BUDGET;

        // Mandate position size
        if (mandate.getMaxPositionSize() != null) {
            BigDecimal limit = mandate.getMaxPositionSizeType() == PositionSizeLimitType.AMOUNT
                    ? mandate.getMaxPositionSize()
                    : Money.percentOf(mandate.getMaxPositionSize(), totalCapital);
            int capped = floorDiv(limit, entry);
            if (capped < planned) {
                planned = capped;
                binding = SizingConstraint.MAX_POSITION_SIZE;
            }
        }

        // Kelly-lite
        int kellyQuantity = floorDiv(kellyFraction(signal).multiply(totalCapital), entry);
        if (kellyQuantity < planned) {
            planned = kellyQuantity;
            binding = SizingConstraint.KELLY_CAP;
        }

        planned = Math.max(planned, 0);
        List<Tranche> tranches = splitTranches(planned, parameters.tranches());

        // Cash applies to the immediate tranche only
        int immediate = tranches.isEmpty() ? 0 : tranches.get(0).quantity();
        int cashQuantity = capByCash(immediate, entry, request.getDeployableCash());
        if (cashQuantity < immediate) {
            binding = SizingConstraint.AVAILABLE_CASH;
            Tranche first = tranches.get(0);
            tranches.set(0, new Tranche(first.index(), first.percent(), cashQuantity, first.releaseCondition()));
        }

        log.debug(
                "Sized {} for account {}: planned={}, immediate={}, binding={}, budget={}, stopDistance={}",
                signal.getSymbol(),
                account.getId(),
                planned,
                cashQuantity,
                binding,
                riskBudget,
                stopDistance);

        return SizingResult.builder()
                .quantity(cashQuantity)
                .plannedQuantity(planned)
                .tranches(List.copyOf(tranches))
                .entryPrice(entry)
                .stopLoss(stop)
                .takeProfit(target)
                .stopDistance(stopDistance)
                .riskAmount(Money.of(stopDistance.multiply(BigDecimal.valueOf(cashQuantity))))
                .notional(Money.notional(entry, cashQuantity))
                .bindingConstraint(binding)
                .build();
    }

    /** Largest quantity up to {@code quantity} that {@code deployableCash} can pay for at {@code entry}. */
    public int capByCash(int quantity, BigDecimal entry, BigDecimal deployableCash) {
        if (deployableCash == null || deployableCash.signum() <= 0 || entry.signum() <= 0) {
            return 0;
        }
        return Math.min(quantity, floorDiv(deployableCash, entry));
    }

    /** Kelly-lite fraction of capital: clamp(confidence × edge / assumedVariance, 0, kellyCap). */
    BigDecimal kellyFraction(Signal signal) {
        BigDecimal edge = signal.getEdgeEstimate() == null
                ? BigDecimal.ZERO
                : signal.getEdgeEstimate().max(BigDecimal.ZERO).divide(Money.HUNDRED, 10, RoundingMode.HALF_UP);
        BigDecimal raw = BigDecimal.valueOf(signal.getConfidence())
                .multiply(edge)
                .divide(positionSizingConfig.getAssumedVariance(), 10, RoundingMode.HALF_UP);
        return raw.max(BigDecimal.ZERO).min(positionSizingConfig.getKellyCap());
    }

    private BigDecimal effectiveAtr(BigDecimal atr, BigDecimal entry) {
        if (atr != null && atr.signum() > 0) {
            return atr;
        }
        return Money.percentOf(positionSizingConfig.getDefaultAtrPercent(), entry);
    }

    /** Splits {@code planned} by percent; rounding leftovers go to the last tranche. */
    private static List<Tranche> splitTranches(int planned, List<TrancheSpec> specs) {
        List<Tranche> tranches = new ArrayList<>();
        int allocated = 0;
        for (int i = 0; i < specs.size(); i++) {
            TrancheSpec spec = specs.get(i);
            int quantity = i == specs.size() - 1
                    ? planned - allocated
                    : BigDecimal.valueOf(planned)
                            .multiply(spec.percent())
                            .divide(Money.HUNDRED, 0, RoundingMode.DOWN)
                            .intValue();
            allocated += quantity;
            tranches.add(new Tranche(i, spec.percent(), quantity, new TrancheReleaseCondition(spec.delayDays())));
        }
        return tranches;
    }

    private static int floorDiv(BigDecimal amount, BigDecimal unit) {
        if (amount.signum() <= 0) {
            return 0;
        }
        return amount.divide(unit, 0, RoundingMode.DOWN).intValue();
    }

    private static SizingResult zero(
            BigDecimal entry, BigDecimal stop, BigDecimal target, BigDecimal stopDistance, SizingConstraint reason) {
        return SizingResult.builder()
                .quantity(0)
                .plannedQuantity(0)
                .entryPrice(entry)
                .stopLoss(stop)
                .takeProfit(target)
                .stopDistance(stopDistance)
                .riskAmount(Money.of(BigDecimal.ZERO))
                .notional(Money.of(BigDecimal.ZERO))
                .bindingConstraint(reason)
                .build();
    }
}
