package com.regimetrader.sizing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Position sizing settings, bound from {@code regimetrader.sizing.*}.
 *
 * <p>Tiers must partition the balance axis: the first starts at 0, each ends where the next
 * begins, and only the last is unbounded. Checked at startup by {@link AccountTierTable}.
 */
@Data
@Component
@ConfigurationProperties(prefix = "regimetrader.sizing")
public class PositionSizingConfig {

    /** Stop distance used when an ATR or structure stop lacks its input. */
    private double defaultStopLossPips = 15.0;

    /** Entries are refused while the spread exceeds the average spread times this. */
    private BigDecimal maxSpreadMultiplier = new BigDecimal("1.5");

    /** Weight of a new observation in the spread moving average. */
    private BigDecimal spreadEmaWeight = new BigDecimal("0.05");

    private List<TierProperties> tiers = new ArrayList<>();

    @Data
    public static class TierProperties {
        private String label;
        private BigDecimal minBalance;
        private BigDecimal maxBalance;
        private BigDecimal maxLotSize;
        private BigDecimal riskPercentPerTrade;
        private int maxConcurrentTrades;
    }
}
