package com.regimetrader.domain.model;

import com.regimetrader.event.RiskEventType;
import com.regimetrader.event.RiskLevel;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** A risk event as shown on the dashboard. */
@Value
@Builder
public class RiskAlert {

    RiskEventType type;
    RiskLevel level;
    String message;
    Map<String, Object> details;
    Instant timestamp;
}
