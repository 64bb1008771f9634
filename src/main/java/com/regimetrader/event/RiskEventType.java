package com.regimetrader.event;

/**
 * Types of {@link RiskEvent}.
 */
public enum RiskEventType {

    /** Daily realized loss reached the limit; breaker latched until the next UTC day. */
    DAILY_LOSS_LIMIT_BREACH,

    /** Drawdown from the equity high-water mark reached the limit; breaker latched. */
    DRAWDOWN_LIMIT_BREACH,

    /** Breaker cleared by drawdown recovery below the hysteresis band or by an operator. */
    CIRCUIT_BREAKER_RESET,

    /** UTC day rolled over; daily aggregates reset. */
    DAILY_RESET,

    /** Retries exhausted against the execution gateway for a position. */
    EXECUTION_FATAL,

    TRADING_HALTED,

    TRADING_RESUMED
}
