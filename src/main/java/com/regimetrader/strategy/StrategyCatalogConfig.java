package com.regimetrader.strategy;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Raw strategy catalog configuration bound from {@code regimetrader.catalog.*}. Converted into
 * validated {@link StrategyDefinition}s once by {@link StrategyCatalog}; never read afterwards.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.catalog")
public class StrategyCatalogConfig {

    /** A strategy must score above this to be selected. */
    private double minStrategyScore = 0.0;

    /** Declaration order is the tie-break order. */
    private List<StrategyProperties> strategies = new ArrayList<>();

    @Data
    public static class StrategyProperties {
        private String name;
        private StrategyKind kind;
        private boolean enabled = true;
        private List<String> symbols = new ArrayList<>();

        /** Keyed by regime bucket, e.g. {@code trending_market: 9}. */
        private Map<String, Double> weights = new LinkedHashMap<>();

        /** Keyed by instrument class, e.g. {@code FOREX: 1.0}. */
        private Map<String, Double> affinity = new LinkedHashMap<>();

        private StopLossProperties stopLoss = new StopLossProperties();
        private TakeProfitProperties takeProfit = new TakeProfitProperties();
        private double riskRewardRatio = 2.0;
        private double maxSpreadPips = 3.0;
        private Map<String, Double> parameters = new LinkedHashMap<>();
    }

    @Data
    public static class StopLossProperties {
        /** FIXED, ATR or STRUCTURE. */
        private String type = "FIXED";
        private double pips = 15.0;
        private double atrMultiplier = 1.5;
        private double bufferPips = 3.0;
    }

    @Data
    public static class TakeProfitProperties {
        /** FIXED, MULTIPLE or TRAILING. */
        private String type = "FIXED";
        private Double ratio;
        private double tp1Ratio = 1.0;
        private double tp2Ratio = 2.0;
        private double tp1Fraction = 0.5;
        private double activationRatio = 1.0;
        private double trailPips = 20.0;
    }
}
