package com.regimetrader.simulator;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * In-memory broker settings, bound from {@code regimetrader.simulator.*}.
 *
 * <p>Failure injection is probabilistic and driven by the seeded random source, so a given seed
 * reproduces the same sequence of rejections and timeouts.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.simulator")
public class SimulatorConfig {

    private long seed = 42L;
    private BigDecimal initialBalance = new BigDecimal("10000");
    private String currency = "USD";
    private Duration barDuration = Duration.ofMinutes(1);
    private int historyBars = 500;

    /** Delay before each execution future completes. */
    private Duration latency = Duration.ZERO;

    private double rejectProbability = 0.0;
    private double timeoutProbability = 0.0;

    /** Per-symbol market shape; symbols not listed use class defaults. */
    private Map<String, MarketProperties> markets = new LinkedHashMap<>();

    @Data
    public static class MarketProperties {
        private Double startPrice;

        /** Standard deviation of the per-bar log return. */
        private Double volatility;

        private Double spreadPips;
    }
}
