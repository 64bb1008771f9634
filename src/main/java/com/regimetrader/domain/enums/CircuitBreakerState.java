package com.regimetrader.domain.enums;

/**
 * Latch state of the risk ledger's circuit breaker.
 */
public enum CircuitBreakerState {
    /** New entries allowed. */
    ARMED,
    /** Daily realized loss limit hit; clears at the next UTC day boundary. */
    DAILY_LOSS_TRIPPED,
    /** Drawdown limit hit; clears on hysteresis recovery or manual reset. */
    DRAWDOWN_TRIPPED
}
