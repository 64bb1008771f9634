package com.regimetrader.api.controller;

import com.regimetrader.domain.model.Position;
import com.regimetrader.oms.TradeLifecycleManager;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Endpoints:
 * <ul>
 *   <li>GET /api/positions -- active (non-closed) positions</li>
 *   <li>POST /api/positions/{id}/close -- request a manual close of an OPEN position</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/positions")
public class PositionController {

    private static final Logger log = LoggerFactory.getLogger(PositionController.class);

    private final TradeLifecycleManager tradeLifecycleManager;

    public PositionController(TradeLifecycleManager tradeLifecycleManager) {
        this.tradeLifecycleManager = tradeLifecycleManager;
    }

    @GetMapping
    public ResponseEntity<List<Position>> listPositions() {
        return ResponseEntity.ok(tradeLifecycleManager.getActivePositions());
    }

    /** Returns the position in CLOSING state; the close completes asynchronously. */
    @PostMapping("/{id}/close")
    public ResponseEntity<Position> closePosition(@PathVariable String id) {
        log.info("Manual close requested for position {}", id);
        return ResponseEntity.ok(tradeLifecycleManager.closeManually(id));
    }
}
