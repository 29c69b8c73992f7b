package com.capitalallocator.guardrail.check;

import com.capitalallocator.domain.enums.GuardrailCheckType;
import com.capitalallocator.domain.enums.GuardrailSeverity;
import com.capitalallocator.domain.model.CheckResult;
import com.capitalallocator.domain.model.GuardrailWarning;
import com.capitalallocator.domain.model.MarketSnapshot;
import com.capitalallocator.guardrail.GuardrailCheck;
import com.capitalallocator.guardrail.GuardrailConfig;
import com.capitalallocator.guardrail.GuardrailContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Warns when an earnings or corporate-action date falls within the blackout window, in either
 * direction, around the evaluation date. Never blocks on its own.
 */
@Component
public class EventWindowCheck implements GuardrailCheck {

    public static final String EVENT_WINDOW_WARNING = "EVENT_WINDOW_WARNING";

    private final GuardrailConfig guardrailConfig;

    public EventWindowCheck(GuardrailConfig guardrailConfig) {
        this.guardrailConfig = guardrailConfig;
    }

    @Override
    public GuardrailCheckType getType() {
        return GuardrailCheckType.EVENT_WINDOW;
    }

    @Override
    public CheckResult evaluate(GuardrailContext context) {
        MarketSnapshot snapshot = context.getSnapshot();
        LocalDate eventDate = snapshot.getNextCorporateEventDate();
        if (eventDate == null) {
            return CheckResult.pass(getType());
        }

        int blackoutDays = context.getMandate().getEarningsBlackoutDays() != null
                ? context.getMandate().getEarningsBlackoutDays()
                : guardrailConfig.getEventBlackoutDays();
        LocalDate today = context.getEvaluatedAt().toLocalDate();
        long daysUntil = ChronoUnit.DAYS.between(today, eventDate);

        if (Math.abs(daysUntil) <= blackoutDays) {
            String eventType = snapshot.getCorporateEventType() != null ? snapshot.getCorporateEventType() : "EVENT";
            Map<String, Object> details = new HashMap<>();
            details.put("eventDate", eventDate.toString());
            details.put("eventType", eventType);
            details.put("daysUntil", daysUntil);
            details.put("blackoutDays", blackoutDays);
            return CheckResult.warning(
                    getType(),
                    GuardrailWarning.of(
                            GuardrailSeverity.WARNING,
                            EVENT_WINDOW_WARNING,
                            eventType + " for " + snapshot.getSymbol() + " on " + eventDate + " is within "
                                    + blackoutDays + " days",
                            details));
        }
        return CheckResult.pass(getType());
    }
}
