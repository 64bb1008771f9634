package com.regimetrader.domain.enums;

/**
 * Trend label emitted by the market condition classifier.
 * UNKNOWN doubles as the "do not trade" signal when confidence is too low.
 */
public enum TrendState {
    BULLISH,
    BEARISH,
    RANGING,
    CHOPPY,
    UNKNOWN;

    public boolean isDirectional() {
        return this == BULLISH || this == BEARISH;
    }
}
