package com.regimetrader.analysis;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Market condition classifier settings, bound from {@code regimetrader.classifier.*}.
 *
 * <p>Volatility thresholds are ATR as a fraction of price. Synthetic indices move several times
 * more than currency pairs, so both thresholds are scaled by {@code syntheticVolatilityMultiplier}
 * for them. {@code minTradingConfidence} is on the 0-100 confidence scale.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.classifier")
public class ClassifierConfig {

    private int trendLookback = 100;
    private int volatilityWindow = 20;
    private int adxPeriod = 14;
    private double trendStrengthThreshold = 0.25;
    private double choppinessThreshold = 61.8;
    private double volatilityLow = 0.0003;
    private double volatilityMedium = 0.0007;
    private double syntheticVolatilityMultiplier = 2.0;
    private double liquidityThreshold = 0.4;
    private double minTradingConfidence = 60.0;
    private int priceActionBars = 5;
    private Duration cacheExpiry = Duration.ofSeconds(300);
    private ConditionWeighting conditionWeighting = new ConditionWeighting();

    /**
     * Weights of the sub-scores combined into the confidence. Also used by the strategy selector
     * as axis weights, with price action weighting the direction axis.
     */
    @Data
    public static class ConditionWeighting {
        private double trend = 0.4;
        private double volatility = 0.3;
        private double liquidity = 0.2;
        private double priceAction = 0.1;

        public double sum() {
            return trend + volatility + liquidity + priceAction;
        }
    }

    /** Fails startup on settings the classifier cannot work with. */
    public void validate() {
        if (Math.abs(conditionWeighting.sum() - 1.0) > 1e-6) {
            throw new IllegalStateException(
                    "regimetrader.classifier.condition-weighting must sum to 1.0, got " + conditionWeighting.sum());
        }
        if (volatilityWindow < 2 || volatilityWindow > trendLookback) {
            throw new IllegalStateException("volatility-window must be within [2, trend-lookback], got "
                    + volatilityWindow);
        }
        if (adxPeriod < 1 || adxPeriod * 2 >= trendLookback) {
            throw new IllegalStateException("adx-period must be positive and under half of trend-lookback");
        }
        if (volatilityLow <= 0 || volatilityMedium <= volatilityLow) {
            throw new IllegalStateException("volatility thresholds must satisfy 0 < low < medium");
        }
        if (minTradingConfidence < 0 || minTradingConfidence > 100) {
            throw new IllegalStateException("min-trading-confidence must be within [0, 100]");
        }
        if (priceActionBars < 1 || priceActionBars > trendLookback) {
            throw new IllegalStateException("price-action-bars must be within [1, trend-lookback]");
        }
    }
}
