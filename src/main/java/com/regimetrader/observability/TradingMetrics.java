package com.regimetrader.observability;

import com.regimetrader.core.engine.TradingOrchestrator;
import com.regimetrader.domain.enums.CycleOutcome;
import com.regimetrader.event.PositionEvent;
import com.regimetrader.event.PositionEventType;
import com.regimetrader.event.RiskEvent;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.oms.TradeLifecycleManager;
import com.regimetrader.risk.RiskLedger;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer meters for the trading loop.
 *
 * <ul>
 *   <li><b>trading.cycles</b> (function counter): completed orchestration cycles</li>
 *   <li><b>trading.outcomes</b> (function counter, tag outcome): per-instrument cycle outcomes</li>
 *   <li><b>positions.entries</b> / <b>positions.closes</b> (counters): fills and final closes</li>
 *   <li><b>execution.fatal</b> (counter): retries exhausted on an open or close</li>
 *   <li><b>circuit.breaker.trips</b> (counter, tag type): daily-loss and drawdown trips</li>
 *   <li><b>risk.drawdown.percent</b>, <b>risk.open.risk</b>, <b>positions.open</b> (gauges)</li>
 * </ul>
 *
 * <p>Gauges are polled by Micrometer at scrape time.
 */
@Service
public class TradingMetrics {

    private static final Logger log = LoggerFactory.getLogger(TradingMetrics.class);

    private final Counter entriesCounter;
    private final Counter closesCounter;
    private final Counter entryFailuresCounter;
    private final Counter executionFatalCounter;
    private final Counter dailyLossTripCounter;
    private final Counter drawdownTripCounter;

    public TradingMetrics(
            MeterRegistry meterRegistry,
            TradingOrchestrator tradingOrchestrator,
            RiskLedger riskLedger,
            TradeLifecycleManager tradeLifecycleManager) {
        this.entriesCounter = Counter.builder("positions.entries")
                .description("Entries filled by the execution gateway")
                .register(meterRegistry);
        this.closesCounter = Counter.builder("positions.closes")
                .description("Positions fully closed")
                .register(meterRegistry);
        this.entryFailuresCounter = Counter.builder("positions.entry.failures")
                .description("Entries rejected by the broker or abandoned after retries")
                .register(meterRegistry);
        this.executionFatalCounter = Counter.builder("execution.fatal")
                .description("Open or close operations that exhausted their retries")
                .register(meterRegistry);
        this.dailyLossTripCounter = Counter.builder("circuit.breaker.trips")
                .tag("type", "daily_loss")
                .register(meterRegistry);
        this.drawdownTripCounter = Counter.builder("circuit.breaker.trips")
                .tag("type", "drawdown")
                .register(meterRegistry);

        FunctionCounter.builder("trading.cycles", tradingOrchestrator, TradingOrchestrator::getCycleCount)
                .description("Orchestration cycles started")
                .register(meterRegistry);
        for (CycleOutcome outcome : CycleOutcome.values()) {
            FunctionCounter.builder("trading.outcomes", tradingOrchestrator, o -> o.getOutcomeCount(outcome))
                    .tag("outcome", outcome.name())
                    .register(meterRegistry);
        }

        meterRegistry.gauge("risk.drawdown.percent", riskLedger, ledger -> ledger.snapshot()
                .getDrawdownPercent()
                .doubleValue());
        meterRegistry.gauge("risk.open.risk", riskLedger, ledger -> ledger.snapshot()
                .getOpenRisk()
                .doubleValue());
        meterRegistry.gauge("positions.open", tradeLifecycleManager, manager -> manager.getActivePositions()
                .size());
    }

    @EventListener
    @Order(20)
    public void onPositionEvent(PositionEvent event) {
        PositionEventType type = event.getEventType();
        if (type == PositionEventType.OPENED) {
            entriesCounter.increment();
        } else if (type == PositionEventType.CLOSED) {
            closesCounter.increment();
        } else if (type == PositionEventType.ENTRY_FAILED) {
            entryFailuresCounter.increment();
        }
    }

    @EventListener
    @Order(20)
    public void onRiskEvent(RiskEvent event) {
        RiskEventType type = event.getEventType();
        if (type == RiskEventType.EXECUTION_FATAL) {
            executionFatalCounter.increment();
            log.warn("Execution fatal recorded: {}", event.getMessage());
        } else if (type == RiskEventType.DAILY_LOSS_LIMIT_BREACH) {
            dailyLossTripCounter.increment();
        } else if (type == RiskEventType.DRAWDOWN_LIMIT_BREACH) {
            drawdownTripCounter.increment();
        }
    }
}
