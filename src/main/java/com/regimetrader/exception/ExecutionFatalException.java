package com.regimetrader.exception;

import java.util.Map;

/**
 * Retries against the execution gateway were exhausted for a position.
 */
public class ExecutionFatalException extends BaseException {

    public ExecutionFatalException(String positionId, String operation, int attempts, String lastError) {
        super(
                ErrorCode.EXECUTION_FATAL,
                String.format("%s for position %s failed after %d attempts: %s", operation, positionId, attempts, lastError),
                Map.of("positionId", positionId, "operation", operation, "attempts", attempts));
    }
}
