package com.regimetrader.strategy.signal;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.strategy.StrategyParameters;
import java.util.Optional;
import org.ta4j.core.BarSeries;

/**
 * Three-bar imbalance revisited by price.
 *
 * <p>A bullish gap exists when a bar's low sits above the high two bars earlier. When the last bar
 * trades back into that gap and closes above its bottom, the gap is treated as support and the
 * signal is a long. Bearish gaps mirror this. Only the newest qualifying gap is considered.
 */
public class FairValueGapSignal implements SignalGenerator {

    private static final int ATR_PERIOD = 14;

    private final StrategyParameters.FairValueGap params;

    public FairValueGapSignal(StrategyParameters.FairValueGap params) {
        this.params = params;
    }

    @Override
    public Optional<TradeSignal> generate(BarSeries series, MarketCondition condition) {
        if (series.getBarCount() < requiredBars()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        double minGap = SeriesMath.atr(series, ATR_PERIOD) * params.minGapAtr();
        double low = SeriesMath.low(series, end);
        double high = SeriesMath.high(series, end);
        double close = SeriesMath.close(series, end);

        for (int i = end - 1; i >= end - params.maxGapAgeBars() && i - 2 >= series.getBeginIndex(); i--) {
            double bottom = SeriesMath.high(series, i - 2);
            double top = SeriesMath.low(series, i);
            if (top - bottom > minGap) {
                if (low <= top && close >= bottom) {
                    return Optional.of(TradeSignal.builder()
                            .direction(TradeDirection.LONG)
                            .structureLevel(bottom)
                            .reason(String.format("Bullish gap %.5f-%.5f revisited", bottom, top))
                            .build());
                }
                return Optional.empty();
            }
            double gapTop = SeriesMath.low(series, i - 2);
            double gapBottom = SeriesMath.high(series, i);
            if (gapTop - gapBottom > minGap) {
                if (high >= gapBottom && close <= gapTop) {
                    return Optional.of(TradeSignal.builder()
                            .direction(TradeDirection.SHORT)
                            .structureLevel(gapTop)
                            .reason(String.format("Bearish gap %.5f-%.5f revisited", gapBottom, gapTop))
                            .build());
                }
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @Override
    public int requiredBars() {
        return Math.max(params.maxGapAgeBars() + 3, ATR_PERIOD + 1);
    }
}
