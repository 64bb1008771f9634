package com.regimetrader.strategy;

public enum RegimeAxis {
    TREND,
    VOLATILITY,
    LIQUIDITY,
    DIRECTION
}
