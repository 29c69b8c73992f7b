package com.capitalallocator.guardrail.check;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import com.capitalallocator.domain.model.CheckResult;
import com.capitalallocator.domain.model.GuardrailWarning;
import com.capitalallocator.domain.model.Signal;
import com.capitalallocator.guardrail.GuardrailCheck;
import com.capitalallocator.guardrail.GuardrailConfig;
import com.capitalallocator.guardrail.GuardrailContext;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Event-driven signals only: the originating catalyst must be younger than
 * {@code catalystFreshnessHours}. Uses the signal's event timestamp, falling back to the
 * snapshot's catalyst timestamp.
 */
@Component
public class CatalystFreshnessCheck implements GuardrailCheck {

    public static final String CATALYST_STALE = "CATALYST_STALE";
    public static final String CATALYST_TIMESTAMP_UNKNOWN = "CATALYST_TIMESTAMP_UNKNOWN";

    private final GuardrailConfig guardrailConfig;

    public CatalystFreshnessCheck(GuardrailConfig guardrailConfig) {
        this.guardrailConfig = guardrailConfig;
    }

    @Override
    public GuardrailCheckType getType() {
        return GuardrailCheckType.CATALYST_FRESHNESS;
    }

    @Override
    public CheckResult evaluate(GuardrailContext context) {
        Signal signal = context.getSignal();
        if (!signal.isEventDriven()) {
            return CheckResult.pass(getType());
        }

        LocalDateTime catalystAt = signal.getEventTimestamp() != null
                ? signal.getEventTimestamp()
                : context.getSnapshot().getCatalystTimestamp();
        if (catalystAt == null) {
            return CheckResult.passWithInfo(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.INFO,
                            CATALYST_TIMESTAMP_UNKNOWN,
                            "No timestamp for event " + signal.getOriginatingEventId()));
        }

        double ageHours = Duration.between(catalystAt, context.getEvaluatedAt()).toMillis() / 3_600_000.0;
        long threshold = guardrailConfig.getCatalystFreshnessHours();
        if (ageHours > threshold) {
            return CheckResult.critical(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.CRITICAL,
                            CATALYST_STALE,
                            "Catalyst " + signal.getOriginatingEventId() + " is "
                                    + String.format("%.1f", ageHours) + "h old, limit " + threshold + "h",
                            Map.of(
                                    "eventId", signal.getOriginatingEventId(),
                                    "ageHours", Math.round(ageHours * 10) / 10.0,
                                    "thresholdHours", threshold)));
        }
        return CheckResult.pass(getType());
    }
}
