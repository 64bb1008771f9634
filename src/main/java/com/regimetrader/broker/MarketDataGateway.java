package com.regimetrader.broker;

import com.regimetrader.domain.model.Bar;
import com.regimetrader.domain.model.Quote;
import java.util.List;

/**
 * Read access to market data. Implementations may block on I/O; callers run on the trading
 * executor, never on a request thread.
 */
public interface MarketDataGateway {

    /**
     * Returns up to {@code count} most recent closed bars, oldest first.
     *
     * @throws com.regimetrader.exception.BusinessException if the instrument is unknown or the
     *     feed is unavailable
     */
    List<Bar> getBars(String symbol, int count);

    /** Current bid/ask. */
    Quote getQuote(String symbol);
}
