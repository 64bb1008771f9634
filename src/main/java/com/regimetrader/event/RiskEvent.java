package com.regimetrader.event;

import java.util.HashMap;
import java.util.Map;
import org.springframework.context.ApplicationEvent;

/**
 * Published when the risk ledger or lifecycle manager detects a risk-relevant condition.
 *
 * <p>Risk events carry the type of condition, its severity, a human-readable message and a
 * details map with condition-specific data (drawdown percent, configured limit, position id).
 *
 * <p>Key listeners:
 * <ul>
 *   <li>DashboardService: keeps the recent-alert list shown to the operator</li>
 *   <li>TradingMetrics: counts breaker trips and execution fatals</li>
 * </ul>
 */
public class RiskEvent extends ApplicationEvent {

    private final RiskEventType eventType;
    private final RiskLevel level;
    private final String message;
    private final Map<String, Object> details;

    public RiskEvent(Object source, RiskEventType eventType, RiskLevel level, String message) {
        this(source, eventType, level, message, null);
    }

    public RiskEvent(
            Object source, RiskEventType eventType, RiskLevel level, String message, Map<String, Object> details) {
        super(source);
        this.eventType = eventType;
        this.level = level;
        this.message = message;
        this.details = details != null ? new HashMap<>(details) : new HashMap<>();
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
     *   <li>DRAWDOWN_LIMIT_BREACH: {"drawdownPercent": 15.2, "limit": 15.0}</li>
     *   <li>EXECUTION_FATAL: {"positionId": "...", "instrument": "EURUSD"}</li>
     * </ul>
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
