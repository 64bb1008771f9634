package com.regimetrader.exception;

import java.util.Map;

/**
 * An order or close request was not confirmed by the execution gateway within its timeout.
 * Retried by the lifecycle manager; escalates to {@link ExecutionFatalException}.
 */
public class ExecutionTimeoutException extends BaseException {

    public ExecutionTimeoutException(String positionId, String operation) {
        super(
                ErrorCode.EXECUTION_TIMEOUT,
                String.format("%s for position %s timed out", operation, positionId),
                Map.of("positionId", positionId, "operation", operation));
    }
}
