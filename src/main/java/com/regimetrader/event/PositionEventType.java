package com.regimetrader.event;

public enum PositionEventType {
    ENTRY_SUBMITTED,
    OPENED,
    ENTRY_FAILED,
    PARTIALLY_CLOSED,
    STOP_ADJUSTED,
    CLOSING,
    CLOSED
}
