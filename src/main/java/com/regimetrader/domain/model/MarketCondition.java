package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.LiquidityLevel;
import com.regimetrader.domain.enums.TrendState;
import com.regimetrader.domain.enums.VolatilityLevel;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Classified regime of one instrument at one point in time. Immutable; a newer
 * classification replaces this one in the classifier cache.
 *
 * <p>{@code confidence} is always within [0, 100]. A degraded condition (insufficient or
 * malformed data) carries UNKNOWN labels, zero confidence, and the reason it degraded.
 */
@Value
@Builder
public class MarketCondition {

    String instrument;
    TrendState trend;
    VolatilityLevel volatility;
    LiquidityLevel liquidity;
    double confidence;
    Instant computedAt;

    /** ADX / 100. */
    double trendStrength;

    /** ATR relative to price over the volatility window, as a fraction. */
    double atrPercent;

    /** Absolute ATR in price units, used by ATR-multiple stops. */
    double atr;

    double liquidityScore;

    boolean degraded;
    String degradationReason;

    public static MarketCondition unknown(String instrument, Instant computedAt, String reason) {
        return MarketCondition.builder()
                .instrument(instrument)
                .trend(TrendState.UNKNOWN)
                .volatility(VolatilityLevel.UNKNOWN)
                .liquidity(LiquidityLevel.UNKNOWN)
                .confidence(0.0)
                .computedAt(computedAt)
                .degraded(true)
                .degradationReason(reason)
                .build();
    }
}
