package com.regimetrader.domain.model;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PerformanceSummary {

    PerformanceStats overall;
    Map<String, PerformanceStats> byStrategy;
    Map<String, PerformanceStats> byInstrument;
}
