package com.regimetrader.api.dto.response;

import com.regimetrader.core.engine.InstrumentStatus;
import com.regimetrader.correlation.CorrelationEntry;
import com.regimetrader.domain.enums.RiskAppetite;
import com.regimetrader.domain.model.PerformanceSummary;
import com.regimetrader.domain.model.Position;
import com.regimetrader.domain.model.RiskAlert;
import com.regimetrader.risk.RiskLedgerSnapshot;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Status feed: per-instrument condition and selection outcome, ledger state, open positions,
 * recent alerts, performance and the correlation matrix.
 */
@Value
@Builder
public class DashboardStatus {

    boolean tradingEnabled;
    RiskAppetite riskAppetite;
    long cycleCount;
    Instant lastCycleAt;
    List<String> activeSessions;
    List<InstrumentStatus> instruments;
    RiskLedgerSnapshot risk;
    List<Position> openPositions;
    List<RiskAlert> alerts;
    PerformanceSummary performance;
    List<CorrelationEntry> correlations;
    Instant generatedAt;
}
