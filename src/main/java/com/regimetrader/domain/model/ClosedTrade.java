package com.regimetrader.domain.model;

import com.regimetrader.domain.enums.CloseReason;
import com.regimetrader.domain.enums.TradeDirection;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Archived view of a closed position.
 */
@Value
@Builder
public class ClosedTrade {

    String id;
    String instrument;
    String strategyName;
    TradeDirection direction;
    BigDecimal entryPrice;
    BigDecimal exitPrice;
    BigDecimal size;
    BigDecimal realizedPnl;
    BigDecimal riskAmount;
    CloseReason closeReason;
    Instant openedAt;
    Instant closedAt;
}
