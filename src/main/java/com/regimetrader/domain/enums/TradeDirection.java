package com.regimetrader.domain.enums;

/**
 * Side of a position. The sign is used in P&L arithmetic: +1 for LONG, -1 for SHORT.
 */
public enum TradeDirection {
    LONG(1),
    SHORT(-1);

    private final int sign;

    TradeDirection(int sign) {
        this.sign = sign;
    }

    public int sign() {
        return sign;
    }

    public TradeDirection opposite() {
        return this == LONG ? SHORT : LONG;
    }
}
