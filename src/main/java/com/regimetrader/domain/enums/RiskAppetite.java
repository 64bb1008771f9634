package com.regimetrader.domain.enums;

import java.math.BigDecimal;

/**
 * Operator-selected risk appetite passed with the start-trading command.
 * Scales the account tier's per-trade risk percentage.
 */
public enum RiskAppetite {
    LOW(new BigDecimal("0.5")),
    MEDIUM(BigDecimal.ONE),
    HIGH(new BigDecimal("1.5"));

    private final BigDecimal multiplier;

    RiskAppetite(BigDecimal multiplier) {
        this.multiplier = multiplier;
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }
}
