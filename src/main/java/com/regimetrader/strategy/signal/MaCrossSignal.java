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
 * Fast EMA crossing the slow EMA on the last bar.
 */
public class MaCrossSignal implements SignalGenerator {

    private final StrategyParameters.MaCross params;

    public MaCrossSignal(StrategyParameters.MaCross params) {
        this.params = params;
    }

    @Override
    public Optional<TradeSignal> generate(BarSeries series, MarketCondition condition) {
        if (series.getBarCount() < requiredBars()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        ClosePriceIndicator close = new ClosePriceIndicator(series);
        EMAIndicator fast = new EMAIndicator(close, params.fastPeriod());
        EMAIndicator slow = new EMAIndicator(close, params.slowPeriod());

        double fastNow = fast.getValue(end).doubleValue();
        double fastPrev = fast.getValue(end - 1).doubleValue();
        double slowNow = slow.getValue(end).doubleValue();
        double slowPrev = slow.getValue(end - 1).doubleValue();
        int swingFrom = end - params.slowPeriod() + 1;

        if (fastPrev <= slowPrev && fastNow > slowNow) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.LONG)
                    .structureLevel(SeriesMath.lowestLow(series, swingFrom, end))
                    .reason("EMA" + params.fastPeriod() + " crossed above EMA" + params.slowPeriod())
                    .build());
        }
        if (fastPrev >= slowPrev && fastNow < slowNow) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.SHORT)
                    .structureLevel(SeriesMath.highestHigh(series, swingFrom, end))
                    .reason("EMA" + params.fastPeriod() + " crossed below EMA" + params.slowPeriod())
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public int requiredBars() {
        return params.slowPeriod() * 2;
    }
}
