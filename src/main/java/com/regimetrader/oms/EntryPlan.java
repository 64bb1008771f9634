package com.regimetrader.oms;

import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.domain.model.TakeProfitLevel;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the lifecycle manager needs to open a position: the sized trade with its stop,
 * targets and risk contribution.
 */
@Value
@Builder
public class EntryPlan {

    Instrument instrument;
    String strategyName;
    TradeDirection direction;
    BigDecimal size;

    /** Quote-side price the plan was sized against. */
    BigDecimal referencePrice;

    BigDecimal stopLoss;

    @Builder.Default
    List<TakeProfitLevel> takeProfits = List.of();

    boolean trailing;
    BigDecimal trailingActivationPrice;
    BigDecimal trailingDistance;
    BigDecimal riskAmount;
}
