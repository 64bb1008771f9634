package com.regimetrader.strategy.signal;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.strategy.StrategyParameters;
import java.util.Optional;
import org.ta4j.core.BarSeries;

/**
 * Break of a range boundary followed by a retest that holds.
 *
 * <p>The range is the {@code rangeBars} bars preceding the break window. A close beyond the range
 * high within the last {@code maxBarsSinceBreak} bars is a break; the signal fires when the last
 * bar dips back to within the ATR tolerance of the broken level and closes beyond it again.
 */
public class BreakAndRetestSignal implements SignalGenerator {

    private static final int ATR_PERIOD = 14;

    private final StrategyParameters.BreakAndRetest params;

    public BreakAndRetestSignal(StrategyParameters.BreakAndRetest params) {
        this.params = params;
    }

    @Override
    public Optional<TradeSignal> generate(BarSeries series, MarketCondition condition) {
        if (series.getBarCount() < requiredBars()) {
            return Optional.empty();
        }
        int end = series.getEndIndex();
        int breakFrom = end - params.maxBarsSinceBreak();
        int rangeTo = breakFrom - 1;
        int rangeFrom = rangeTo - params.rangeBars() + 1;

        double resistance = SeriesMath.highestHigh(series, rangeFrom, rangeTo);
        double support = SeriesMath.lowestLow(series, rangeFrom, rangeTo);
        double tolerance = SeriesMath.atr(series, ATR_PERIOD) * params.retestToleranceAtr();

        boolean brokeUp = false;
        boolean brokeDown = false;
        for (int i = breakFrom; i < end; i++) {
            double close = SeriesMath.close(series, i);
            brokeUp |= close > resistance;
            brokeDown |= close < support;
        }

        double low = SeriesMath.low(series, end);
        double high = SeriesMath.high(series, end);
        double close = SeriesMath.close(series, end);
        if (brokeUp && low <= resistance + tolerance && close > resistance) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.LONG)
                    .structureLevel(Math.min(low, resistance))
                    .reason(String.format("Retest of broken resistance %.5f", resistance))
                    .build());
        }
        if (brokeDown && high >= support - tolerance && close < support) {
            return Optional.of(TradeSignal.builder()
                    .direction(TradeDirection.SHORT)
                    .structureLevel(Math.max(high, support))
                    .reason(String.format("Retest of broken support %.5f", support))
                    .build());
        }
        return Optional.empty();
    }

    @Override
    public int requiredBars() {
        return Math.max(params.rangeBars() + params.maxBarsSinceBreak() + 1, ATR_PERIOD + 1);
    }
}
