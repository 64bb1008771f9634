package com.regimetrader.domain.enums;

/**
 * Result of one orchestration cycle for one instrument, as shown on the dashboard.
 */
public enum CycleOutcome {
    /** Not yet evaluated since startup. */
    IDLE,
    INACTIVE,
    CLOSE_ONLY,
    OUTSIDE_SESSION,
    CIRCUIT_BREAKER,
    DATA_UNAVAILABLE,
    NO_STRATEGY,
    NO_SIGNAL,
    ADMISSION_REJECTED,
    SIZING_REJECTED,
    ENTRY_SUBMITTED,
    ERROR
}
