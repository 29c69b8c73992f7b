package com.capitalallocator.guardrail;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import com.capitalallocator.domain.model.CheckResult;
import com.capitalallocator.domain.model.GuardrailResult;
import com.capitalallocator.domain.model.GuardrailWarning;
import com.capitalallocator.observability.AllocationMetricsService;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs every guardrail check against a proposed trade and reduces the outcomes to one
 * {@link GuardrailResult}.
 *
 * <p>All six checks always run, in {@link GuardrailCheckType} order, so a blocked caller still
 * sees the full picture. A check that throws is recorded as CRITICAL
 * {@code <TYPE>_CHECK_ERROR}: an unverifiable trade is treated as unsafe.
 *
 * <p>Exactly one check per {@link GuardrailCheckType} must be registered; startup fails otherwise.
 */
@Service
public class GuardrailEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GuardrailEvaluator.class);

    private final List<GuardrailCheck> checks;
    private final GuardrailConfig guardrailConfig;
    private final AllocationMetricsService metricsService;

    public GuardrailEvaluator(
            List<GuardrailCheck> checks, GuardrailConfig guardrailConfig, AllocationMetricsService metricsService) {
        Set<GuardrailCheckType> seen = EnumSet.noneOf(GuardrailCheckType.class);
        for (GuardrailCheck check : checks) {
            if (!seen.add(check.getType())) {
                throw new IllegalStateException("Duplicate guardrail check for " + check.getType());
            }
        }
        if (seen.size() != GuardrailCheckType.values().length) {
            Set<GuardrailCheckType> missing = EnumSet.complementOf(EnumSet.copyOf(seen));
            throw new IllegalStateException("Missing guardrail checks: " + missing);
        }
        List<GuardrailCheck> ordered = new ArrayList<>(checks);
        ordered.sort(Comparator.comparing(GuardrailCheck::getType));
        this.checks = List.copyOf(ordered);
        this.guardrailConfig = guardrailConfig;
        this.metricsService = metricsService;
    }

    public GuardrailResult evaluate(GuardrailContext context) {
        long start = System.nanoTime();
        List<CheckResult> results = new ArrayList<>(checks.size());
        for (GuardrailCheck check : checks) {
            results.add(runCheck(check, context));
        }
        long durationNanos = System.nanoTime() - start;

        GuardrailResult result = new GuardrailResult(
                context.getAccount().getId(),
                context.getSignal().getId(),
                context.getSignal().getSymbol(),
                results,
                durationNanos / 1_000_000,
                context.getEvaluatedAt());

        metricsService.recordGuardrailEvaluation(result, durationNanos);
        if (result.isHasCriticalFailure()) {
            log.info(
                    "Guardrails blocked {} for account {}: {}",
                    result.getSymbol(),
                    result.getAccountId(),
                    result.getCriticalCodes());
        } else if (!result.isPassedAll()) {
            log.info(
                    "Guardrails passed {} for account {} with warnings: {}",
                    result.getSymbol(),
                    result.getAccountId(),
                    result.getWarningCodes());
        }
        return result;
    }

    /**
     * Whether the result stops a reservation: any CRITICAL, or any WARNING when
     * {@code allocator.guardrails.block-on-warning} is set.
     */
    public boolean isBlocking(GuardrailResult result) {
        return result.isHasCriticalFailure() || (guardrailConfig.isBlockOnWarning() && result.hasWarnings());
    }

    /** Codes recorded on a block: the CRITICAL codes, or the WARNING codes when warnings block. */
    public List<String> blockingCodes(GuardrailResult result) {
        if (result.isHasCriticalFailure()) {
            return result.getCriticalCodes();
        }
        return result.getWarningCodes();
    }

    private CheckResult runCheck(GuardrailCheck check, GuardrailContext context) {
        try {
            return check.evaluate(context);
        } catch (RuntimeException e) {
            log.error(
                    "Guardrail check {} failed for {} on account {}: {}",
                    check.getType(),
                    context.getSignal().getSymbol(),
                    context.getAccount().getId(),
                    e.getMessage(),
                    e);
            return CheckResult.critical(
                    check.getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.CRITICAL,
                            check.getType().name() + "_CHECK_ERROR",
                            "Check could not be evaluated: " + e.getMessage(),
                            Map.of("exception", e.getClass().getSimpleName())));
        }
    }
}
