package com.regimetrader.domain.enums;

/**
 * Why a position reached CLOSED.
 */
public enum CloseReason {
    TAKE_PROFIT,
    STOP_LOSS,
    AGED,
    MANUAL,
    STRATEGY_REVERSAL,
    /** Entry order was rejected or never confirmed. */
    ENTRY_FAILED
}
