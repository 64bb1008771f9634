package com.regimetrader.core.engine;

import com.regimetrader.domain.enums.CycleOutcome;
import com.regimetrader.domain.model.MarketCondition;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of the latest cycle for one instrument, as shown on the dashboard.
 */
@Value
@Builder(toBuilder = true)
public class InstrumentStatus {

    String symbol;
    boolean active;
    CycleOutcome outcome;
    String detail;
    MarketCondition condition;
    String selectedStrategy;
    Double selectionScore;
    Instant updatedAt;
}
