package com.regimetrader.domain.enums;

/**
 * Broad instrument families. Synthetic indices trade around the clock and are classified
 * with wider volatility thresholds than currency pairs.
 */
public enum InstrumentClass {
    FOREX,
    SYNTHETIC_VOLATILITY,
    SYNTHETIC_CRASH_BOOM,
    SYNTHETIC_STEP,
    SYNTHETIC_JUMP;

    public boolean isSynthetic() {
        return this != FOREX;
    }
}
