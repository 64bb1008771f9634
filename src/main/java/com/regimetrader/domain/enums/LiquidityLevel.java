package com.regimetrader.domain.enums;

public enum LiquidityLevel {
    LOW,
    MEDIUM,
    HIGH,
    UNKNOWN
}
