package com.regimetrader.strategy.signal;

import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.TradeSignal;
import java.util.Optional;
import org.ta4j.core.BarSeries;

/**
 * Entry signal contract implemented by every strategy kind. Implementations are stateless and
 * evaluate the last bar of the series.
 */
public interface SignalGenerator {

    /** Signal on the series' last bar, or empty when there is none or too little data. */
    Optional<TradeSignal> generate(BarSeries series, MarketCondition condition);

    /** Minimum number of bars the generator needs. */
    int requiredBars();
}
