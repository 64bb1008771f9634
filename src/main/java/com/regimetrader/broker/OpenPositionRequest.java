package com.regimetrader.broker;

import com.regimetrader.domain.enums.TradeDirection;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Market entry request. {@code positionId} is the client-side id; the broker uses it as the
 * handle for later closes, so a retried open with the same id must not open twice.
 */
@Value
@Builder
public class OpenPositionRequest {

    String positionId;
    String symbol;
    TradeDirection direction;
    BigDecimal size;
    BigDecimal stopLoss;
    String strategyName;
}
