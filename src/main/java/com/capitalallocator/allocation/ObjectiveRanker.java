package com.capitalallocator.allocation;

import com.capitalallocator.domain.enums.Objective;
import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.domain.model.Signal;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Comparator;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Orders eligible signals for one account by an objective-specific score.
 *
 * <p>With {@code edge = max(edgeEstimate, 0) / 100} and {@code vol} the ATR as a percent of
 * price:
 * <ul>
 *   <li>MAX_PROFIT: {@code edge × confidence / (1 + 0.25 × vol)}</li>
 *   <li>RISK_MINIMIZED: {@code confidence² × √edge / (1 + vol)}</li>
 *   <li>BALANCED: geometric mean of the two</li>
 * </ul>
 * Ties go to the higher confidence, then the lexicographically smaller symbol. Ranking only
 * orders candidates; it never drops one.
 */
@Component
public class ObjectiveRanker {

    static final Comparator<RankedSignal> ORDER = Comparator.comparingDouble(RankedSignal::score)
            .reversed()
            .thenComparing(Comparator.comparingDouble((RankedSignal r) -> r.signal().getConfidence())
                    .reversed())
            .thenComparing(r -> r.signal().getSymbol())
            .thenComparing(r -> r.signal().getId(), Comparator.nullsLast(Comparator.naturalOrder()));

    private final RankingConfig rankingConfig;

    public ObjectiveRanker(RankingConfig rankingConfig) {
        this.rankingConfig = rankingConfig;
    }

    public List<RankedSignal> rank(List<RankCandidate> candidates, Objective objective) {
        return candidates.stream()
                .map(c -> new RankedSignal(
                        c, score(c.signal(), objective, c.snapshot()) * c.parameters().priorityBoost()))
                .sorted(ORDER)
                .toList();
    }

    /** Unboosted objective score. */
    public double score(Signal signal, Objective objective, MarketSnapshot snapshot) {
        double edge = Math.max(signal.getEdgeEstimate() == null ? 0.0 : signal.getEdgeEstimate().doubleValue(), 0.0)
                / 100.0;
        double confidence = signal.getConfidence();
        double vol = volatilityPercent(snapshot);

        double maxProfit = edge * confidence / (1.0 + rankingConfig.getMaxProfitVolatilityPenalty() * vol);
        double riskMinimized = confidence * confidence * Math.sqrt(edge) / (1.0 + vol);

        return switch (objective) {
            case MAX_PROFIT -> maxProfit;
            case RISK_MINIMIZED -> riskMinimized;
            case BALANCED -> Math.sqrt(maxProfit * riskMinimized);
        };
    }

    double volatilityPercent(MarketSnapshot snapshot) {
        if (snapshot == null
                || snapshot.getAtr() == null
                || snapshot.getPrice() == null
                || snapshot.getPrice().signum() <= 0
                || snapshot.getAtr().signum() <= 0) {
            return rankingConfig.getDefaultVolatilityPercent();
        }
        return snapshot.getAtr()
                .multiply(BigDecimal.valueOf(100))
                .divide(snapshot.getPrice(), MathContext.DECIMAL64)
                .doubleValue();
    }
}
