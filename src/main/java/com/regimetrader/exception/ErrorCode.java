package com.regimetrader.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    CONFLICT("CONFLICT", 409),
    CIRCUIT_BREAKER_TRIPPED("CIRCUIT_BREAKER_TRIPPED", 423),
    RISK_LIMIT_EXCEEDED("RISK_LIMIT_EXCEEDED", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    EXECUTION_FATAL("EXECUTION_FATAL", 502),
    EXECUTION_TIMEOUT("EXECUTION_TIMEOUT", 504);

    private final String code;
    private final int httpStatus;
}
