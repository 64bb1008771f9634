package com.regimetrader.risk;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Account-wide limits enforced by the {@link RiskLedger}.
 *
 * <p>Percentages are plain numbers (15 means 15%); {@code maxDailyRisk} is a fraction of the
 * day-start equity. A null {@code maxOpenPositions} disables that check.
 */
@Value
@Builder
public class RiskLimits {

    @Builder.Default
    BigDecimal maxDailyRisk = new BigDecimal("0.05");

    @Builder.Default
    BigDecimal maxDrawdownPercent = new BigDecimal("15");

    @Builder.Default
    BigDecimal drawdownHysteresisPercent = new BigDecimal("5");

    Integer maxOpenPositions;

    public void validate() {
        if (maxDailyRisk == null || maxDailyRisk.signum() <= 0 || maxDailyRisk.compareTo(BigDecimal.ONE) >= 0) {
            throw new IllegalStateException("max-daily-risk must be within (0, 1), got " + maxDailyRisk);
        }
        if (maxDrawdownPercent == null
                || maxDrawdownPercent.signum() <= 0
                || maxDrawdownPercent.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new IllegalStateException("max-drawdown-percent must be within (0, 100], got " + maxDrawdownPercent);
        }
        if (drawdownHysteresisPercent == null
                || drawdownHysteresisPercent.signum() < 0
                || drawdownHysteresisPercent.compareTo(maxDrawdownPercent) >= 0) {
            throw new IllegalStateException(
                    "drawdown-hysteresis-percent must be within [0, max-drawdown-percent), got "
                            + drawdownHysteresisPercent);
        }
        if (maxOpenPositions != null && maxOpenPositions < 1) {
            throw new IllegalStateException("max-open-positions must be at least 1 when set");
        }
    }
}
