package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Current bid/ask for an instrument.
 */
@Value
@Builder
public class Quote {

    String symbol;
    BigDecimal bid;
    BigDecimal ask;
    Instant timestamp;

    public BigDecimal getSpread() {
        return ask.subtract(bid);
    }

    public BigDecimal getMid() {
        return bid.add(ask).divide(BigDecimal.valueOf(2), bid.scale() + 2, RoundingMode.HALF_UP);
    }

    /** Price a new position in the given direction would be filled at. */
    public BigDecimal entryPrice(TradeDirection direction) {
        return direction == TradeDirection.LONG ? ask : bid;
    }

    /** Price an existing position in the given direction would be closed at. */
    public BigDecimal exitPrice(TradeDirection direction) {
        return direction == TradeDirection.LONG ? bid : ask;
    }
}
