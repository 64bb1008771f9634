package com.regimetrader.api.controller;

import com.regimetrader.risk.RiskLedger;
import com.regimetrader.risk.RiskLedgerSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints:
 * <ul>
 *   <li>GET /api/risk -- ledger snapshot (equity, drawdown, open risk, breaker state)</li>
 *   <li>POST /api/risk/circuit-breaker/reset -- manual reset of a drawdown trip</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/risk")
public class RiskController {

    private static final Logger log = LoggerFactory.getLogger(RiskController.class);

    private final RiskLedger riskLedger;

    public RiskController(RiskLedger riskLedger) {
        this.riskLedger = riskLedger;
    }

    @GetMapping
    public ResponseEntity<RiskLedgerSnapshot> getRisk() {
        return ResponseEntity.ok(riskLedger.snapshot());
    }

    @PostMapping("/circuit-breaker/reset")
    public ResponseEntity<RiskLedgerSnapshot> resetCircuitBreaker() {
        log.warn("Circuit breaker reset requested via API");
        return ResponseEntity.ok(riskLedger.resetCircuitBreaker("API"));
    }
}
