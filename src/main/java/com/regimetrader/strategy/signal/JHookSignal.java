package com.regimetrader.strategy.signal;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.strategy.StrategyParameters;
import java.util.Optional;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * J-hook continuation: a strong impulse with the trend, a shallow pullback that holds the trend
 * EMA, then a bar breaking the previous bar's extreme in the impulse direction.
 */
public class JHookSignal implements SignalGenerator {

    private static final int ATR_PERIOD = 14;

    private final StrategyParameters.JHook params;

    public JHookSignal(StrategyParameters.JHook params) {
        this.params = params;
    }

    @Override
    public Optional<TradeSignal> generate(BarSeries series, MarketCondition condition) {
        if (series.getBarCount() < requiredBars()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        int pullbackFrom = end - params.pullbackBars();
        int impulseFrom = pullbackFrom - params.impulseBars();
        double ema = new EMAIndicator(new ClosePriceIndicator(series), params.trendPeriod())
                .getValue(end)
                .doubleValue();
        double atr = SeriesMath.atr(series, ATR_PERIOD);

        double impulse = SeriesMath.close(series, pullbackFrom - 1) - SeriesMath.close(series, impulseFrom);
        if (atr <= 0 || Math.abs(impulse) < params.minImpulseAtr() * atr) {
            return Optional.empty();
        }

        double close = SeriesMath.close(series, end);
        if (impulse > 0) {
            double impulseHigh = SeriesMath.highestHigh(series, impulseFrom, pullbackFrom - 1);
            double pullbackLow = SeriesMath.lowestLow(series, pullbackFrom, end - 1);
            double retrace = (impulseHigh - pullbackLow) / impulse;
            if (retrace > 0 && retrace <= params.maxPullbackRatio() && pullbackLow > ema
                    && close > SeriesMath.high(series, end - 1)) {
                return Optional.of(TradeSignal.builder()
                        .direction(TradeDirection.LONG)
                        .structureLevel(pullbackLow)
                        .reason(String.format("J-hook long after %.0f%% pullback", retrace * 100))
                        .build());
            }
        } else {
            double impulseLow = SeriesMath.lowestLow(series, impulseFrom, pullbackFrom - 1);
            double pullbackHigh = SeriesMath.highestHigh(series, pullbackFrom, end - 1);
            double retrace = (pullbackHigh - impulseLow) / -impulse;
            if (retrace > 0 && retrace <= params.maxPullbackRatio() && pullbackHigh < ema
                    && close < SeriesMath.low(series, end - 1)) {
                return Optional.of(TradeSignal.builder()
                        .direction(TradeDirection.SHORT)
                        .structureLevel(pullbackHigh)
                        .reason(String.format("J-hook short after %.0f%% pullback", retrace * 100))
                        .build());
            }
        }
        return Optional.empty();
    }

    @Override
    public int requiredBars() {
        return Math.max(params.trendPeriod(), params.impulseBars() + params.pullbackBars() + ATR_PERIOD) + 1;
    }
}
