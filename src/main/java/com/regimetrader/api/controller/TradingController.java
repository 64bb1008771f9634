package com.regimetrader.api.controller;

import com.regimetrader.api.dto.request.StartTradingRequest;
import com.regimetrader.api.dto.request.ToggleInstrumentRequest;
import com.regimetrader.core.engine.TradingOrchestrator;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator commands. They only flip orchestrator flags; entries still pass every check.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /api/trading/start -- enable entries {instruments?, riskLevel?}</li>
 *   <li>POST /api/trading/stop -- close-only mode</li>
 *   <li>POST /api/instruments/{symbol}/toggle -- activate or deactivate one instrument</li>
 * </ul>
 */
@RestController
@RequestMapping("/api")
public class TradingController {

    private static final Logger log = LoggerFactory.getLogger(TradingController.class);

    private final TradingOrchestrator tradingOrchestrator;

    public TradingController(TradingOrchestrator tradingOrchestrator) {
        this.tradingOrchestrator = tradingOrchestrator;
    }

    @PostMapping("/trading/start")
    public ResponseEntity<Map<String, Object>> start(@RequestBody(required = false) StartTradingRequest request) {
        StartTradingRequest body = request != null ? request : new StartTradingRequest();
        log.info("Start trading requested: instruments {}, risk level {}", body.getInstruments(), body.getRiskLevel());
        tradingOrchestrator.startTrading(body.getInstruments(), body.getRiskLevel());
        return ResponseEntity.ok(tradingState());
    }

    @PostMapping("/trading/stop")
    public ResponseEntity<Map<String, Object>> stop() {
        log.info("Stop trading requested");
        tradingOrchestrator.stopTrading();
        return ResponseEntity.ok(tradingState());
    }

    @PostMapping("/instruments/{symbol}/toggle")
    public ResponseEntity<Map<String, Object>> toggle(
            @PathVariable String symbol, @Valid @RequestBody ToggleInstrumentRequest request) {
        tradingOrchestrator.toggleInstrument(symbol, request.getActive());
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("symbol", symbol);
        result.put("active", request.getActive());
        return ResponseEntity.ok(result);
    }

    private Map<String, Object> tradingState() {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("tradingEnabled", tradingOrchestrator.isTradingEnabled());
        state.put("riskAppetite", tradingOrchestrator.getRiskAppetite());
        return state;
    }
}
