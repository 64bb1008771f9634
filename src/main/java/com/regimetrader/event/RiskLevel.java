package com.regimetrader.event;

/**
 * Severity level for a {@link RiskEvent}.
 *
 * <p>INFO is for routine transitions, WARNING for conditions the operator should look at, and
 * CRITICAL for conditions that halted entries or left a position needing attention.
 */
public enum RiskLevel {
    INFO,
    WARNING,
    CRITICAL
}
