package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.InstrumentClass;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Static contract specification for a tradable instrument.
 */
@Value
@Builder
public class Instrument {

    String symbol;
    InstrumentClass instrumentClass;

    /** Smallest quoted increment counted as one pip (0.0001 for EURUSD, 0.01 for USDJPY). */
    BigDecimal pipSize;

    /** Account-currency value of one pip for one standard lot. */
    BigDecimal pipValuePerLot;

    @Builder.Default
    BigDecimal lotStep = new BigDecimal("0.01");

    @Builder.Default
    BigDecimal minLot = new BigDecimal("0.01");
}
