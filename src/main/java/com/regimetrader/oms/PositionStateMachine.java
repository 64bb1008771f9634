package com.regimetrader.oms;

import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.model.Position;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Allowed position status transitions.
 *
 * <pre>
 * PENDING_ENTRY -> OPEN -> CLOSING -> CLOSED
 * PENDING_ENTRY -> CLOSED   (entry failed)
 * </pre>
 *
 * CLOSED is terminal.
 */
public final class PositionStateMachine {

    private static final Map<PositionStatus, Set<PositionStatus>> TRANSITIONS = new EnumMap<>(PositionStatus.class);

    static {
        TRANSITIONS.put(PositionStatus.PENDING_ENTRY, EnumSet.of(PositionStatus.OPEN, PositionStatus.CLOSED));
        TRANSITIONS.put(PositionStatus.OPEN, EnumSet.of(PositionStatus.CLOSING));
        TRANSITIONS.put(PositionStatus.CLOSING, EnumSet.of(PositionStatus.CLOSED));
        TRANSITIONS.put(PositionStatus.CLOSED, EnumSet.noneOf(PositionStatus.class));
    }

    private PositionStateMachine() {}

    public static boolean canTransition(PositionStatus from, PositionStatus to) {
        return TRANSITIONS.get(from).contains(to);
    }

    /**
     * Moves the position to {@code to}.
     *
     * @throws IllegalStateException if the transition is not allowed, including any move out of CLOSED
     */
    public static void transition(Position position, PositionStatus to) {
        PositionStatus from = position.getStatus();
        if (!canTransition(from, to)) {
            throw new IllegalStateException(
                    "Invalid position transition " + from + " -> " + to + " for " + position.getId());
        }
        position.setStatus(to);
    }
}
