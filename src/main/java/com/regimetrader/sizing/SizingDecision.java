package com.regimetrader.sizing;

import com.regimetrader.domain.model.AccountTier;
import com.regimetrader.domain.model.TakeProfitLevel;
import java.math.BigDecimal;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Result of sizing an entry. When {@code tradeable} is false the size is zero and
 * {@code rejectionReason} says why.
 */
@Value
@Builder
public class SizingDecision {

    boolean tradeable;
    BigDecimal size;
    double stopLossPips;
    BigDecimal stopLossPrice;
    List<TakeProfitLevel> takeProfits;
    boolean trailing;
    BigDecimal trailingActivationPrice;
    BigDecimal trailingDistance;

    /** Money lost if the stop is hit. */
    BigDecimal riskAmount;

    AccountTier tier;
    String rejectionReason;

    public static SizingDecision rejected(String reason, AccountTier tier) {
        return SizingDecision.builder()
                .tradeable(false)
                .size(BigDecimal.ZERO)
                .takeProfits(List.of())
                .riskAmount(BigDecimal.ZERO)
                .tier(tier)
                .rejectionReason(reason)
                .build();
    }
}
