package com.regimetrader.service;

import com.regimetrader.api.dto.response.DashboardStatus;
import com.regimetrader.core.engine.TradingOrchestrator;
import com.regimetrader.correlation.CorrelationManager;
import com.regimetrader.domain.model.RiskAlert;
import com.regimetrader.event.RiskEvent;
import com.regimetrader.oms.TradeLifecycleManager;
import com.regimetrader.risk.RiskLedger;
import com.regimetrader.session.TradingSessionFilter;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Builds the operator status feed and keeps the most recent risk alerts (breaker trips,
 * execution fatals naming the position, halts and resets), newest first.
 */
@Service
public class DashboardService {

    private final TradingOrchestrator tradingOrchestrator;
    private final RiskLedger riskLedger;
    private final TradeLifecycleManager tradeLifecycleManager;
    private final CorrelationManager correlationManager;
    private final PositionArchiveService positionArchiveService;
    private final TradingSessionFilter tradingSessionFilter;
    private final Clock clock;
    private final int maxAlerts;

    private final Deque<RiskAlert> alerts = new ArrayDeque<>();

    public DashboardService(
            TradingOrchestrator tradingOrchestrator,
            RiskLedger riskLedger,
            TradeLifecycleManager tradeLifecycleManager,
            CorrelationManager correlationManager,
            PositionArchiveService positionArchiveService,
            TradingSessionFilter tradingSessionFilter,
            Clock clock,
            @Value("${regimetrader.dashboard.max-alerts:50}") int maxAlerts) {
        this.tradingOrchestrator = tradingOrchestrator;
        this.riskLedger = riskLedger;
        this.tradeLifecycleManager = tradeLifecycleManager;
        this.correlationManager = correlationManager;
        this.positionArchiveService = positionArchiveService;
        this.tradingSessionFilter = tradingSessionFilter;
        this.clock = clock;
        this.maxAlerts = maxAlerts;
    }

    @EventListener
    public void onRiskEvent(RiskEvent event) {
        RiskAlert alert = RiskAlert.builder()
                .type(event.getEventType())
                .level(event.getLevel())
                .message(event.getMessage())
                .details(event.getDetails())
                .timestamp(Instant.ofEpochMilli(event.getTimestamp()))
                .build();
        synchronized (alerts) {
            alerts.addFirst(alert);
            while (alerts.size() > maxAlerts) {
                alerts.removeLast();
            }
        }
    }

    public List<RiskAlert> getRecentAlerts() {
        synchronized (alerts) {
            return new ArrayList<>(alerts);
        }
    }

    public DashboardStatus getStatus() {
        Instant now = clock.instant();
        return DashboardStatus.builder()
                .tradingEnabled(tradingOrchestrator.isTradingEnabled())
                .riskAppetite(tradingOrchestrator.getRiskAppetite())
                .cycleCount(tradingOrchestrator.getCycleCount())
                .lastCycleAt(tradingOrchestrator.getLastCycleAt())
                .activeSessions(tradingSessionFilter.activeSessions(now))
                .instruments(tradingOrchestrator.getInstrumentStatuses())
                .risk(riskLedger.snapshot())
                .openPositions(tradeLifecycleManager.getActivePositions())
                .alerts(getRecentAlerts())
                .performance(positionArchiveService.getPerformance())
                .correlations(correlationManager.snapshot())
                .generatedAt(now)
                .build();
    }
}
