package com.regimetrader.strategy;

import com.regimetrader.domain.model.MarketCondition;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Buckets of the regime axes that strategies weight. Config keys follow the
 * {@code trending_market} / {@code high_volatility} naming used in strategy weight tables.
 */
public enum RegimeKey {
    TRENDING_MARKET(RegimeAxis.TREND, "trending_market"),
    RANGING_MARKET(RegimeAxis.TREND, "ranging_market"),
    CHOPPY_MARKET(RegimeAxis.TREND, "choppy_market"),
    LOW_VOLATILITY(RegimeAxis.VOLATILITY, "low_volatility"),
    MEDIUM_VOLATILITY(RegimeAxis.VOLATILITY, "medium_volatility"),
    HIGH_VOLATILITY(RegimeAxis.VOLATILITY, "high_volatility"),
    LOW_LIQUIDITY(RegimeAxis.LIQUIDITY, "low_liquidity"),
    MEDIUM_LIQUIDITY(RegimeAxis.LIQUIDITY, "medium_liquidity"),
    HIGH_LIQUIDITY(RegimeAxis.LIQUIDITY, "high_liquidity"),
    BULLISH_MARKET(RegimeAxis.DIRECTION, "bullish_market"),
    BEARISH_MARKET(RegimeAxis.DIRECTION, "bearish_market"),
    NEUTRAL_MARKET(RegimeAxis.DIRECTION, "neutral_market");

    private final RegimeAxis axis;
    private final String configKey;

    RegimeKey(RegimeAxis axis, String configKey) {
        this.axis = axis;
        this.configKey = configKey;
    }

    public RegimeAxis getAxis() {
        return axis;
    }

    public String getConfigKey() {
        return configKey;
    }

    public static Optional<RegimeKey> fromConfigKey(String key) {
        for (RegimeKey regimeKey : values()) {
            if (regimeKey.configKey.equalsIgnoreCase(key)) {
                return Optional.of(regimeKey);
            }
        }
        return Optional.empty();
    }

    /**
     * The bucket of each axis the condition falls into. Axes whose label is UNKNOWN are absent
     * and contribute nothing to a score.
     */
    public static Map<RegimeAxis, RegimeKey> bucketsOf(MarketCondition condition) {
        Map<RegimeAxis, RegimeKey> buckets = new EnumMap<>(RegimeAxis.class);
        switch (condition.getTrend()) {
            case BULLISH -> {
                buckets.put(RegimeAxis.TREND, TRENDING_MARKET);
                buckets.put(RegimeAxis.DIRECTION, BULLISH_MARKET);
            }
            case BEARISH -> {
                buckets.put(RegimeAxis.TREND, TRENDING_MARKET);
                buckets.put(RegimeAxis.DIRECTION, BEARISH_MARKET);
            }
            case RANGING -> {
                buckets.put(RegimeAxis.TREND, RANGING_MARKET);
                buckets.put(RegimeAxis.DIRECTION, NEUTRAL_MARKET);
            }
            case CHOPPY -> {
                buckets.put(RegimeAxis.TREND, CHOPPY_MARKET);
                buckets.put(RegimeAxis.DIRECTION, NEUTRAL_MARKET);
            }
            case UNKNOWN -> {
                // no trend or direction bucket
            }
        }
        switch (condition.getVolatility()) {
            case LOW -> buckets.put(RegimeAxis.VOLATILITY, LOW_VOLATILITY);
            case MEDIUM -> buckets.put(RegimeAxis.VOLATILITY, MEDIUM_VOLATILITY);
            case HIGH -> buckets.put(RegimeAxis.VOLATILITY, HIGH_VOLATILITY);
            case UNKNOWN -> {
                // no volatility bucket
            }
        }
        switch (condition.getLiquidity()) {
            case LOW -> buckets.put(RegimeAxis.LIQUIDITY, LOW_LIQUIDITY);
            case MEDIUM -> buckets.put(RegimeAxis.LIQUIDITY, MEDIUM_LIQUIDITY);
            case HIGH -> buckets.put(RegimeAxis.LIQUIDITY, HIGH_LIQUIDITY);
            case UNKNOWN -> {
                // no liquidity bucket
            }
        }
        return buckets;
    }
}
