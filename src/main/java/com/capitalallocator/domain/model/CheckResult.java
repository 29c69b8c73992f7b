package com.capitalallocator.domain.model;

import com.capitalallocator.domain.enums.CheckStatus;
import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import java.util.List;
import lombok.Getter;

/**
 * Outcome of one guardrail check. INFO findings never change a PASS status.
 */
@Getter
public class CheckResult {

    private final GuardrailCheckType type;
    private final CheckStatus status;
    private final List<GuardrailWarning> warnings;

    private CheckResult(GuardrailCheckType type, CheckStatus status, List<GuardrailWarning> warnings) {
        this.type = type;
        this.status = status;
        this.warnings = List.copyOf(warnings);
    }

    public static CheckResult pass(GuardrailCheckType type) {
        return new CheckResult(type, CheckStatus.PASS, List.of());
    }

    /** A pass that still carries an INFO finding, e.g. an unknown sector. */
    public static CheckResult passWithInfo(GuardrailCheckType type, GuardrailWarning info) {
        return new CheckResult(type, CheckStatus.PASS, List.of(info));
    }

    public static CheckResult warning(GuardrailCheckType type, GuardrailWarning warning) {
        return new CheckResult(type, CheckStatus.WARNING, List.of(warning));
    }

    public static CheckResult critical(GuardrailCheckType type, GuardrailWarning critical) {
        return new CheckResult(type, CheckStatus.CRITICAL, List.of(critical));
    }

    /** Derives the status from the most severe finding. */
    public static CheckResult of(GuardrailCheckType type, List<GuardrailWarning> warnings) {
        CheckStatus status = CheckStatus.PASS;
        for (GuardrailWarning warning : warnings) {
            if (warning.getSeverity() == GuardrailSeverity.CRITICAL) {
                status = CheckStatus.CRITICAL;
            } else if (warning.getSeverity() == GuardrailSeverity.WARNING && status == CheckStatus.PASS) {
                status = CheckStatus.WARNING;
            }
        }
        return new CheckResult(type, status, warnings);
    }

    public boolean isPassed() {
        return status == CheckStatus.PASS;
    }

    public boolean isCritical() {
        return status == CheckStatus.CRITICAL;
    }
}
