package com.regimetrader.exception;

import java.util.Map;

/**
 * Thrown when an operator command would open new risk while the circuit breaker is latched.
 */
public class CircuitBreakerTrippedException extends BaseException {

    public CircuitBreakerTrippedException(String state, String reason) {
        super(
                ErrorCode.CIRCUIT_BREAKER_TRIPPED,
                "Circuit breaker is tripped: " + reason,
                Map.of("state", state, "reason", reason != null ? reason : ""));
    }
}
