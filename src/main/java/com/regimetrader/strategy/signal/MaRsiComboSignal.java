package com.regimetrader.strategy.signal;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.strategy.StrategyParameters;
import java.util.Optional;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.EMAIndicator;
import org.ta4j.core.indicators.RSIIndicator;
import org.ta4j.core.indicators.helpers.ClosePriceIndicator;

/**
 * Trades RSI recoveries in the direction of the moving-average trend: with the fast EMA above
 * the slow one, RSI climbing back out of oversold is a long; the mirror image is a short.
 */
public class MaRsiComboSignal implements SignalGenerator {

    private final StrategyParameters.MaRsiCombo params;

    public MaRsiComboSignal(StrategyParameters.MaRsiCombo params) {
        this.params = params;
    }

    @Override
    public Optional<TradeSignal> generate(BarSeries series, MarketCondition condition) {
        if (series.getBarCount() < requiredBars()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        double fast = new EMAIndicator(close, params.fastPeriod()).getValue(end).doubleValue();
        double slow = new EMAIndicator(close, params.slowPeriod()).getValue(end).doubleValue();
        RSIIndicator rsi = new RSIIndicator(close, params.rsiPeriod());
        double rsiNow = rsi.getValue(end).doubleValue();
        double rsiPrev = rsi.getValue(end - 1).doubleValue();
        int swingFrom = end - params.rsiPeriod();

        if (fast > slow && rsiPrev < params.oversold() && rsiNow >= params.oversold()) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.LONG)
                    .structureLevel(SeriesMath.lowestLow(series, swingFrom, end))
                    .reason(String.format("RSI recovered above %.0f in uptrend", params.oversold()))
                    .build());
        }
        if (fast < slow && rsiPrev > params.overbought() && rsiNow <= params.overbought()) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.SHORT)
                    .structureLevel(SeriesMath.highestHigh(series, swingFrom, end))
                    .reason(String.format("RSI fell below %.0f in downtrend", params.overbought()))
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public int requiredBars() {
        return Math.max(params.slowPeriod(), params.rsiPeriod()) + 2;
    }
}
