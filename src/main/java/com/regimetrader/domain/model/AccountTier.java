package com.regimetrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Balance bucket deciding position limits. Ranges are half-open: {@code [minBalance, maxBalance)};
 * a null {@code maxBalance} means unbounded.
 */
@Value
@Builder
public class AccountTier {

    String label;
    BigDecimal minBalance;
    BigDecimal maxBalance;
    BigDecimal maxLotSize;

    /** Fraction of equity risked per trade, e.g. 0.015 for 1.5%. */
    BigDecimal riskPercentPerTrade;

    int maxConcurrentTrades;

    public boolean contains(BigDecimal balance) {
        if (balance.compareTo(minBalance) < 0) {
            return false;
        }
        return maxBalance == null || balance.compareTo(maxBalance) < 0;
    }
}
