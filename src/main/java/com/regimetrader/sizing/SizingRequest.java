package com.regimetrader.sizing;

import com.regimetrader.domain.enums.RiskAppetite;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.AccountTier;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.strategy.RiskParams;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SizingRequest {

    Instrument instrument;
    BigDecimal equity;
    AccountTier tier;
    RiskParams riskParams;
    TradeDirection direction;
    BigDecimal entryPrice;

    /** ATR in price units; 0 when unavailable. */
    double atr;

    /** Structure level from the signal, null when the strategy provides none. */
    Double structureLevel;

    BigDecimal currentSpread;

    /** Moving-average spread, null before the first observation. */
    BigDecimal averageSpread;

    @Builder.Default
    RiskAppetite riskAppetite = RiskAppetite.MEDIUM;
}
