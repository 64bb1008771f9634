package com.regimetrader.domain.enums;

/**
 * Lifecycle states of a position.
 *
 * <p>PENDING_ENTRY and CLOSING are "awaiting external confirmation" states. CLOSED is terminal.
 */
public enum PositionStatus {
    PENDING_ENTRY,
    OPEN,
    CLOSING,
    CLOSED
}
