package com.regimetrader.strategy.signal;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.strategy.StrategyParameters;
import java.util.Optional;
import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.SMAIndicator;
import org.ta4j.core.indicators.StochasticOscillatorKIndicator;

/**
 * %K crossing %D inside the oversold (long) or overbought (short) zone.
 */
public class StochasticCrossSignal implements SignalGenerator {

    private final StrategyParameters.StochasticCross params;

    public StochasticCrossSignal(StrategyParameters.StochasticCross params) {
        this.params = params;
    }

    @Override
    public Optional<TradeSignal> generate(BarSeries series, MarketCondition condition) {
        if (series.getBarCount() < requiredBars()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        StochasticOscillatorKIndicator k = new StochasticOscillatorKIndicator(series, params.kPeriod());
        SMAIndicator d = new SMAIndicator(k, params.dPeriod());
        double kNow = k.getValue(end).doubleValue();
        double kPrev = k.getValue(end - 1).doubleValue();
        double dNow = d.getValue(end).doubleValue();
        double dPrev = d.getValue(end - 1).doubleValue();
        int swingFrom = end - params.kPeriod() + 1;

        if (kPrev <= dPrev && kNow > dNow && kPrev < params.oversold()) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.LONG)
                    .structureLevel(SeriesMath.lowestLow(series, swingFrom, end))
                    .reason("%K crossed above %D in oversold zone")
                    .build());
        }
        if (kPrev >= dPrev && kNow < dNow && kPrev > params.overbought()) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.SHORT)
                    .structureLevel(SeriesMath.highestHigh(series, swingFrom, end))
                    .reason("%K crossed below %D in overbought zone")
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public int requiredBars() {
        return params.kPeriod() + params.dPeriod() + 1;
    }
}
