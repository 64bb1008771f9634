package com.regimetrader.api.controller;

import com.regimetrader.api.dto.response.DashboardStatus;
import com.regimetrader.correlation.CorrelationEntry;
import com.regimetrader.correlation.CorrelationManager;
import com.regimetrader.domain.model.PerformanceSummary;
import com.regimetrader.service.DashboardService;
import com.regimetrader.service.PositionArchiveService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only views of the trading system.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/status -- full dashboard feed</li>
 *   <li>GET /api/correlations -- current correlation matrix entries</li>
 *   <li>GET /api/performance -- closed-trade statistics, overall and per strategy/instrument</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class StatusController {

    private final DashboardService dashboardService;
    private final CorrelationManager correlationManager;
    private final PositionArchiveService positionArchiveService;

    public StatusController(
            DashboardService dashboardService,
            CorrelationManager correlationManager,
            PositionArchiveService positionArchiveService) {
        this.dashboardService = dashboardService;
        this.correlationManager = correlationManager;
        this.positionArchiveService = positionArchiveService;
    }

    @GetMapping("/status")
    public ResponseEntity<DashboardStatus> getStatus() {
        return ResponseEntity.ok(dashboardService.getStatus());
    }

    @GetMapping("/correlations")
    public ResponseEntity<List<CorrelationEntry>> getCorrelations() {
        return ResponseEntity.ok(correlationManager.snapshot());
    }

    @GetMapping("/performance")
    public ResponseEntity<PerformanceSummary> getPerformance() {
        return ResponseEntity.ok(positionArchiveService.getPerformance());
    }
}
