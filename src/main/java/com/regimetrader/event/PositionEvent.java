package com.regimetrader.event;

import com.regimetrader.domain.model.Position;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the lifecycle manager on every position state change. Carries a copy of the
 * position taken at publish time.
 */
public class PositionEvent extends ApplicationEvent {

    private final Position position;
    private final PositionEventType eventType;

    public PositionEvent(Object source, Position position, PositionEventType eventType) {
        super(source);
        this.position = position;
        this.eventType = eventType;
    }

    public Position getPosition() {
        return position;
    }

    public PositionEventType getEventType() {
        return eventType;
    }
}
