package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.TradeDirection;
import lombok.Builder;
import lombok.Value;

/**
 * Entry signal emitted by a strategy's signal generator.
 */
@Value
@Builder
public class TradeSignal {

    TradeDirection direction;

    /**
     * Price of the market structure the signal is anchored on (swing low for a long, swing high
     * for a short). Used by structure-buffer stops; null when the strategy has none.
     */
    Double structureLevel;

    String reason;
}
