package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.CheckStatus;
import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.Getter;

/**
 * Write-once outcome of running all guardrail checks against one (signal, account) pair.
 *
 * <p>{@code passedAll} is true only when no check reported WARNING or CRITICAL; INFO findings
 * are carried in {@link #getWarnings()} but do not count. {@code hasCriticalFailure} is true
 * when at least one check reported CRITICAL.
 */
@Getter
public class GuardrailResult {

    private final String accountId;
    private final String signalId;
    private final String symbol;

    private final boolean liquidityCheck;
    private final boolean positionSizeCheck;
    private final boolean exposureCheck;
    private final boolean eventWindowCheck;
    private final boolean regimeCheck;
    private final boolean catalystFreshnessCheck;

    private final Map<GuardrailCheckType, CheckResult> checkResults;
    private final List<GuardrailWarning> warnings;

    private final boolean passedAll;
    private final boolean hasCriticalFailure;
    private final long durationMs;
    private final LocalDateTime evaluatedAt;

    public GuardrailResult(
            String accountId,
            String signalId,
            String symbol,
            List<CheckResult> results,
            long durationMs,
            LocalDateTime evaluatedAt) {
        this.accountId = accountId;
        this.signalId = signalId;
        this.symbol = symbol;
        this.durationMs = durationMs;
        this.evaluatedAt = evaluatedAt;

        Map<GuardrailCheckType, CheckResult> byType = new EnumMap<>(GuardrailCheckType.class);
        List<GuardrailWarning> allWarnings = new ArrayList<>();
        for (CheckResult result : results) {
            byType.put(result.getType(), result);
            allWarnings.addAll(result.getWarnings());
        }
        this.checkResults = Collections.unmodifiableMap(byType);
        this.warnings = List.copyOf(allWarnings);

        this.liquidityCheck = passed(byType, GuardrailCheckType.LIQUIDITY);
        this.positionSizeCheck = passed(byType, GuardrailCheckType.POSITION_SIZE);
        this.exposureCheck = passed(byType, GuardrailCheckType.SECTOR_EXPOSURE);
        this.eventWindowCheck = passed(byType, GuardrailCheckType.EVENT_WINDOW);
        this.regimeCheck = passed(byType, GuardrailCheckType.REGIME);
        this.catalystFreshnessCheck = passed(byType, GuardrailCheckType.CATALYST_FRESHNESS);

        this.hasCriticalFailure = results.stream().anyMatch(CheckResult::isCritical);
        this.passedAll = results.stream().allMatch(CheckResult::isPassed);
    }

    private static boolean passed(Map<GuardrailCheckType, CheckResult> byType, GuardrailCheckType type) {
        CheckResult result = byType.get(type);
        return result != null && result.isPassed();
    }

    public boolean hasWarnings() {
        return checkResults.values().stream().anyMatch(r -> r.getStatus() == CheckStatus.WARNING);
    }

    /** Codes of the CRITICAL findings, in check order. */
    public List<String> getCriticalCodes() {
        return codesWithSeverity(GuardrailSeverity.CRITICAL);
    }

    public List<String> getWarningCodes() {
        return codesWithSeverity(GuardrailSeverity.WARNING);
    }

    private List<String> codesWithSeverity(GuardrailSeverity severity) {
        return warnings.stream()
                .filter(w -> w.getSeverity() == severity)
                .map(GuardrailWarning::getCode)
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "GuardrailResult{" + accountId + "/" + signalId + " passedAll=" + passedAll + " critical="
                + hasCriticalFailure + " warnings=" + warnings + "}";
    }
}
