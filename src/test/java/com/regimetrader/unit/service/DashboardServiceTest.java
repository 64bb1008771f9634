package com.regimetrader.unit.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import com.regimetrader.api.dto.response.DashboardStatus;
import com.regimetrader.core.engine.TradingOrchestrator;
import com.regimetrader.correlation.CorrelationManager;
import com.regimetrader.domain.enums.RiskAppetite;
import com.regimetrader.domain.model.RiskAlert;
import com.regimetrader.event.RiskEvent;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.event.RiskLevel;
import com.regimetrader.oms.TradeLifecycleManager;
import com.regimetrader.risk.RiskLedger;
import com.regimetrader.risk.RiskLedgerSnapshot;
import com.regimetrader.service.DashboardService;
import com.regimetrader.service.PositionArchiveService;
import com.regimetrader.session.TradingSessionFilter;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DashboardServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-04T13:30:00Z");

    @Mock
    private TradingOrchestrator tradingOrchestrator;

    @Mock
    private RiskLedger riskLedger;

    @Mock
    private TradeLifecycleManager tradeLifecycleManager;

    @Mock
    private CorrelationManager correlationManager;

    @Mock
    private PositionArchiveService positionArchiveService;

    @Mock
    private TradingSessionFilter tradingSessionFilter;

    private DashboardService dashboardService;

    @BeforeEach
    void setUp() {
        dashboardService = new DashboardService(
                tradingOrchestrator,
                riskLedger,
                tradeLifecycleManager,
                correlationManager,
                positionArchiveService,
                tradingSessionFilter,
                Clock.fixed(NOW, ZoneOffset.UTC),
                3);
    }

    private static RiskEvent event(RiskEventType type, String message) {
        return new RiskEvent(DashboardServiceTest.class, type, RiskLevel.WARNING, message, Map.<String, Object>of("k", "v"));
    }

    @Test
    @DisplayName("alerts are kept newest first and bounded")
    void alertsBounded() {
        for (int i = 1; i <= 5; i++) {
            dashboardService.onRiskEvent(event(RiskEventType.TRADING_HALTED, "alert " + i));
        }

        List<RiskAlert> alerts = dashboardService.getRecentAlerts();

        assertThat(alerts).extracting(RiskAlert::getMessage).containsExactly("alert 5", "alert 4", "alert 3");
        assertThat(alerts.get(0).getDetails()).containsEntry("k", "v");
        assertThat(alerts.get(0).getType()).isEqualTo(RiskEventType.TRADING_HALTED);
    }

    @Test
    @DisplayName("status assembles every component's view")
    void status() {
        RiskLedgerSnapshot snapshot = RiskLedgerSnapshot.builder().openPositionCount(1).build();
        when(tradingOrchestrator.isTradingEnabled()).thenReturn(true);
        when(tradingOrchestrator.getRiskAppetite()).thenReturn(RiskAppetite.HIGH);
        when(tradingOrchestrator.getCycleCount()).thenReturn(12L);
        when(tradingSessionFilter.activeSessions(any())).thenReturn(List.of("london", "newyork"));
        when(riskLedger.snapshot()).thenReturn(snapshot);
        dashboardService.onRiskEvent(event(RiskEventType.DRAWDOWN_LIMIT_BREACH, "Drawdown limit breached"));

        DashboardStatus status = dashboardService.getStatus();

        assertThat(status.isTradingEnabled()).isTrue();
        assertThat(status.getRiskAppetite()).isEqualTo(RiskAppetite.HIGH);
        assertThat(status.getCycleCount()).isEqualTo(12);
        assertThat(status.getActiveSessions()).containsExactly("london", "newyork");
        assertThat(status.getRisk()).isSameAs(snapshot);
        assertThat(status.getAlerts()).hasSize(1);
        assertThat(status.getGeneratedAt()).isEqualTo(NOW);
    }
}
