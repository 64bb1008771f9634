package com.regimetrader.broker;

import java.math.BigDecimal;

/**
 * Broker answer to an open or close request. Price and size are set only when FILLED; the
 * reason only when REJECTED or TIMEOUT.
 */
public record ExecutionResult(ExecutionStatus status, BigDecimal price, BigDecimal size, String reason) {

    public static ExecutionResult filled(BigDecimal price, BigDecimal size) {
        return new ExecutionResult(ExecutionStatus.FILLED, price, size, null);
    }

    public static ExecutionResult rejected(String reason) {
        return new ExecutionResult(ExecutionStatus.REJECTED, null, null, reason);
    }

    public static ExecutionResult timeout() {
        return new ExecutionResult(ExecutionStatus.TIMEOUT, null, null, "broker timeout");
    }

    public boolean isFilled() {
        return status == ExecutionStatus.FILLED;
    }
}
