package com.regimetrader.broker;

public enum ExecutionStatus {
    FILLED,
    REJECTED,
    TIMEOUT
}
