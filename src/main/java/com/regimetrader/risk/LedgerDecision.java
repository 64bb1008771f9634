package com.regimetrader.risk;

import java.math.BigDecimal;

/**
 * Outcome of {@link RiskLedger#recordOpen}. When committed, {@code openRisk} is the ledger's open
 * risk including the new position.
 */
public record LedgerDecision(boolean committed, String reason, BigDecimal openRisk) {

    public static LedgerDecision committed(BigDecimal openRisk) {
        return new LedgerDecision(true, null, openRisk);
    }

    public static LedgerDecision rejected(String reason) {
        return new LedgerDecision(false, reason, null);
    }
}
