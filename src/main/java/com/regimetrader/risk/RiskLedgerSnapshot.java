package com.regimetrader.risk;

import com.regimetrader.domain.enums.CircuitBreakerState;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Read-only copy of the ledger state, taken under the ledger lock.
 */
@Value
@Builder
public class RiskLedgerSnapshot {

    LocalDate tradingDay;
    BigDecimal equity;
    BigDecimal dayStartEquity;
    BigDecimal highWaterMark;
    BigDecimal drawdownPercent;
    BigDecimal dailyRealizedPnl;
    BigDecimal openRisk;
    BigDecimal dailyRiskBudget;
    BigDecimal remainingRiskBudget;
    int openPositionCount;
    Map<String, Integer> openPositionsByInstrument;

    /** Open risk summed per correlation group; ungrouped instruments form their own group. */
    Map<String, BigDecimal> openRiskByCorrelationGroup;

    CircuitBreakerState circuitBreakerState;

    /** Why the breaker is latched, null when armed. */
    String tripReason;
    boolean dailyLossTripped;
    boolean drawdownTripped;
    String accountTier;
}
