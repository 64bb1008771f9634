package com.regimetrader.core.engine;

import com.regimetrader.domain.enums.RiskAppetite;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Trading cycle settings, bound from {@code regimetrader.orchestration.*}. The cycle interval
 * itself is read by the scheduler from {@code regimetrader.orchestration.cycle-interval-ms}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.orchestration")
public class OrchestrationConfig {

    private long cycleIntervalMs = 60_000;
    private long initialDelayMs = 5_000;

    /** Longest the cycle waits for its per-instrument workers. */
    private Duration cycleTimeout = Duration.ofSeconds(30);

    /** Bars fetched per instrument per cycle. */
    private int barCount = 200;

    /** New entries are allowed from startup; otherwise they wait for a start command. */
    private boolean tradingEnabledOnStartup = false;

    private RiskAppetite defaultRiskAppetite = RiskAppetite.MEDIUM;
}
