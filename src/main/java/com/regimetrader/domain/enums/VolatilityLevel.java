package com.regimetrader.domain.enums;

public enum VolatilityLevel {
    LOW,
    MEDIUM,
    HIGH,
    UNKNOWN
}
