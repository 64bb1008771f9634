package com.regimetrader.domain.model;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One OHLCV bar as delivered by the market data feed.
 *
 * <p>Prices are doubles since bars feed statistics and indicators only; money is always
 * BigDecimal elsewhere. {@code spread} is the average bid/ask spread over the bar in price
 * units, 0 when the feed does not report it.
 */
@Value
@Builder(toBuilder = true)
public class Bar {

    Instant openTime;
    double open;
    double high;
    double low;
    double close;
    double volume;
    double spread;

    /** True when all prices are finite and positive and high/low bound open and close. */
    public boolean isWellFormed() {
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low) || !Double.isFinite(close)) {
            return false;
        }
        if (!Double.isFinite(volume) || volume < 0 || !Double.isFinite(spread) || spread < 0) {
            return false;
        }
        if (open <= 0 || high <= 0 || low <= 0 || close <= 0) {
            return false;
        }
        return high >= low && high >= Math.max(open, close) && low <= Math.min(open, close);
    }

    public double range() {
        return high - low;
    }
}
