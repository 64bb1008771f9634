package com.regimetrader.strategy.signal;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.strategy.StrategyParameters;
import java.util.Optional;
import org.ta4j.core.BarSeries;

/**
 * Close through the most recent swing high (long) or swing low (short) within the lookback.
 * A swing point exceeds the {@code swingStrength} bars on both sides of it.
 */
public class BreakOfStructureSignal implements SignalGenerator {

    private final StrategyParameters.BreakOfStructure params;

    public BreakOfStructureSignal(StrategyParameters.BreakOfStructure params) {
        this.params = params;
    }

    @Override
    public Optional<TradeSignal> generate(BarSeries series, MarketCondition condition) {
        if (series.getBarCount() < requiredBars()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        int from = end - params.lookbackBars();
        Double swingHigh = null;
        Double swingLow = null;
        // newest candidate has swingStrength confirmed bars after it, excluding the breaking bar
        for (int i = end - 1 - params.swingStrength(); i >= from + params.swingStrength(); i--) {
            if (swingHigh == null && isSwingHigh(series, i)) {
                swingHigh = SeriesMath.high(series, i);
            }
            if (swingLow == null && isSwingLow(series, i)) {
                swingLow = SeriesMath.low(series, i);
            }
            if (swingHigh != null && swingLow != null) {
                break;
            }
        }

        double close = SeriesMath.close(series, end);
        double prevClose = SeriesMath.close(series, end - 1);
        if (swingHigh != null && prevClose <= swingHigh && close > swingHigh) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.LONG)
                    .structureLevel(swingLow != null ? swingLow : SeriesMath.lowestLow(series, from, end))
                    .reason(String.format("Close broke swing high %.5f", swingHigh))
                    .build());
        }
        if (swingLow != null && prevClose >= swingLow && close < swingLow) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.SHORT)
                    .structureLevel(swingHigh != null ? swingHigh : SeriesMath.highestHigh(series, from, end))
                    .reason(String.format("Close broke swing low %.5f", swingLow))
                    .build());
        }
        return Optional.empty();
    }

    private boolean isSwingHigh(BarSeries series, int index) {
        double high = SeriesMath.high(series, index);
        for (int offset = 1; offset <= params.swingStrength(); offset++) {
            if (SeriesMath.high(series, index - offset) >= high || SeriesMath.high(series, index + offset) >= high) {
                return false;
            }
        }
        return true;
    }

    private boolean isSwingLow(BarSeries series, int index) {
        double low = SeriesMath.low(series, index);
        for (int offset = 1; offset <= params.swingStrength(); offset++) {
            if (SeriesMath.low(series, index - offset) <= low || SeriesMath.low(series, index + offset) <= low) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int requiredBars() {
        return params.lookbackBars() + 1;
    }
}
