package com.regimetrader.sizing;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Exponential moving average of observed spreads per instrument. The first observation seeds
 * the average.
 */
@Component
public class SpreadTracker {

    private final BigDecimal weight;
    private final Map<String, BigDecimal> averages = new ConcurrentHashMap<>();

    public SpreadTracker(PositionSizingConfig config) {
        this.weight = config.getSpreadEmaWeight();
    }

    public BigDecimal update(String symbol, BigDecimal spread) {
        return averages.merge(
                symbol,
                spread,
                (average, observed) -> average.multiply(BigDecimal.ONE.subtract(weight))
                        .add(observed.multiply(weight))
                        .round(MathContext.DECIMAL64));
    }

    public Optional<BigDecimal> averageSpread(String symbol) {
        return Optional.ofNullable(averages.get(symbol));
    }
}
