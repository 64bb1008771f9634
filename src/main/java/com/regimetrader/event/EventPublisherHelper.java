package com.regimetrader.event;

import com.regimetrader.domain.model.Position;
import java.util.Map;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Convenience wrapper around Spring's {@link ApplicationEventPublisher} with typed factory
 * methods for the trading events.
 *
 * <p>All methods are non-blocking as far as the caller is concerned; delivery depends on the
 * listener annotations.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Position ----

    public void publishPosition(Object source, Position position, PositionEventType eventType) {
        applicationEventPublisher.publishEvent(new PositionEvent(source, position.copy(), eventType));
    }

    // ---- Risk ----

    public void publishRisk(Object source, RiskEventType type, RiskLevel level, String message) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, type, level, message));
    }

    public void publishRisk(
            Object source, RiskEventType type, RiskLevel level, String message, Map<String, Object> details) {
        applicationEventPublisher.publishEvent(new RiskEvent(source, type, level, message, details));
    }
}
