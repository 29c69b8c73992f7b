package com.capitalallocator.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when a risk condition changes the state of an account: kill switch trips and resets,
 * reservation expiries, and accounts skipped for bad configuration.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>AllocationMetricsService counts trips and expiries</li>
 *   <li>Alerting and reporting, outside this service</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final String accountId;
    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, String accountId, RiskEventType eventType, RiskLevel level, String message) {
        this(source, accountId, eventType, level, message, null);
    }

    public RiskEvent(
            Object source,
            String accountId,
            RiskEventType eventType,
            RiskLevel level,
            String message,
            Map<String, Object> details) {
        super(source);
        this.accountId = accountId;
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
    }

    public String getAccountId() {
        return accountId;
    }

    public RiskEventType getEventType() {
        return eventType;
    }

    public RiskLevel getLevel() {
        return level;
    }

    public String getMessage() {
        return message;
    }

    /**
     * Condition-specific details. For example:
     * <ul>
     *   <li>KILL_SWITCH_TRIPPED: {"kind": "MAX_DAILY_LOSS", "value": -6000.00, "threshold": -5000}</li>
     *   <li>RESERVATION_EXPIRED: {"reservationId": "...", "amount": 47000.00}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
