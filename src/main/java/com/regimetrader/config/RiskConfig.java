package com.regimetrader.config;

import com.regimetrader.broker.AccountGateway;
import com.regimetrader.correlation.CorrelationManager;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.risk.RiskLedger;
import com.regimetrader.risk.RiskLimits;
import com.regimetrader.sizing.AccountTierTable;
import com.regimetrader.sizing.PositionSizingConfig;
import java.math.BigDecimal;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the account-wide risk state: limits from {@code regimetrader.risk.*}, the tier table
 * from {@code regimetrader.sizing.tiers}, and the single {@link RiskLedger} seeded with the
 * account's equity at startup.
 *
 * <p>{@code max-open-positions} defaults to null (check skipped).
 */
@Configuration
public class RiskConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RiskLimits riskLimits(
            @Value("${regimetrader.risk.max-daily-risk:0.05}") BigDecimal maxDailyRisk,
            @Value("${regimetrader.risk.max-drawdown-percent:15}") BigDecimal maxDrawdownPercent,
            @Value("${regimetrader.risk.drawdown-hysteresis-percent:5}") BigDecimal drawdownHysteresisPercent,
            @Value("${regimetrader.risk.max-open-positions:#{null}}") Integer maxOpenPositions) {
        return RiskLimits.builder()
                .maxDailyRisk(maxDailyRisk)
                .maxDrawdownPercent(maxDrawdownPercent)
                .drawdownHysteresisPercent(drawdownHysteresisPercent)
                .maxOpenPositions(maxOpenPositions)
                .build();
    }

    @Bean
    public AccountTierTable accountTierTable(PositionSizingConfig positionSizingConfig) {
        return AccountTierTable.fromConfig(positionSizingConfig.getTiers());
    }

    @Bean
    public RiskLedger riskLedger(
            RiskLimits riskLimits,
            AccountTierTable accountTierTable,
            EventPublisherHelper eventPublisherHelper,
            AccountGateway accountGateway,
            CorrelationManager correlationManager,
            Clock clock) {
        BigDecimal equity = accountGateway.getAccountInfo().getEquity();
        RiskLedger riskLedger = new RiskLedger(riskLimits, accountTierTable, eventPublisherHelper, clock, equity);
        riskLedger.setRiskGroupResolver(correlationManager::riskGroupOf);
        return riskLedger;
    }
}
