package com.regimetrader.core.engine;

import com.regimetrader.analysis.BarSeriesFactory;
import com.regimetrader.analysis.MarketConditionClassifier;
import com.regimetrader.broker.AccountGateway;
import com.regimetrader.broker.MarketDataGateway;
import com.regimetrader.correlation.CorrelationManager;
import com.regimetrader.domain.enums.CycleOutcome;
import com.regimetrader.domain.enums.RiskAppetite;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.AccountInfo;
import com.regimetrader.domain.model.Bar;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.Position;
import com.regimetrader.domain.model.Quote;
import com.regimetrader.domain.model.TradeSignal;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.event.RiskLevel;
import com.regimetrader.exception.CircuitBreakerTrippedException;
import com.regimetrader.instrument.InstrumentRegistry;
import com.regimetrader.oms.EntryPlan;
import com.regimetrader.oms.EntrySubmission;
import com.regimetrader.oms.TradeLifecycleManager;
import com.regimetrader.risk.AdmissionDecision;
import com.regimetrader.risk.RiskLedger;
import com.regimetrader.session.TradingSessionFilter;
import com.regimetrader.sizing.PositionSizer;
import com.regimetrader.sizing.SizingDecision;
import com.regimetrader.sizing.SizingRequest;
import com.regimetrader.sizing.SpreadTracker;
import com.regimetrader.strategy.StrategyCatalog;
import com.regimetrader.strategy.StrategyDefinition;
import com.regimetrader.strategy.StrategySelection;
import com.regimetrader.strategy.StrategySelector;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs the trading cycle: for every configured instrument, monitor open positions, classify the
 * market, pick a strategy, and, when everything admits it, size and submit an entry.
 *
 * <p><b>Cycle:</b> the ledger day is rolled and equity marked first, then one worker per
 * instrument runs on the trading executor. The cycle waits at most {@code cycle-timeout} for its
 * workers; stragglers keep running but do not hold up the next cycle's schedule.
 *
 * <p><b>Close-only mode:</b> monitoring and closing always run. New entries stop when trading is
 * disabled, the instrument is inactive, the circuit breaker is latched, or the session filter
 * rejects the current time.
 *
 * <p>Operator commands only flip flags; every entry still goes through the same checks.
 */
@Service
public class TradingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(TradingOrchestrator.class);

    private final InstrumentRegistry instrumentRegistry;
    private final MarketDataGateway marketDataGateway;
    private final AccountGateway accountGateway;
    private final MarketConditionClassifier marketConditionClassifier;
    private final StrategySelector strategySelector;
    private final StrategyCatalog strategyCatalog;
    private final CorrelationManager correlationManager;
    private final PositionSizer positionSizer;
    private final SpreadTracker spreadTracker;
    private final RiskLedger riskLedger;
    private final TradeLifecycleManager tradeLifecycleManager;
    private final TradingSessionFilter tradingSessionFilter;
    private final OrchestrationConfig orchestrationConfig;
    private final ThreadPoolTaskExecutor tradingExecutor;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final AtomicBoolean tradingEnabled;
    private volatile RiskAppetite riskAppetite;
    private final Map<String, InstrumentStatus> statuses = new ConcurrentHashMap<>();
    private final AtomicLong cycleCount = new AtomicLong();
    private final Map<CycleOutcome, AtomicLong> outcomeCounts = new EnumMap<>(CycleOutcome.class);
    private volatile Instant lastCycleAt;

    public TradingOrchestrator(
            InstrumentRegistry instrumentRegistry,
            MarketDataGateway marketDataGateway,
            AccountGateway accountGateway,
            MarketConditionClassifier marketConditionClassifier,
            StrategySelector strategySelector,
            StrategyCatalog strategyCatalog,
            CorrelationManager correlationManager,
            PositionSizer positionSizer,
            SpreadTracker spreadTracker,
            RiskLedger riskLedger,
            TradeLifecycleManager tradeLifecycleManager,
            TradingSessionFilter tradingSessionFilter,
            OrchestrationConfig orchestrationConfig,
            @Qualifier("tradingExecutor") ThreadPoolTaskExecutor tradingExecutor,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.instrumentRegistry = instrumentRegistry;
        this.marketDataGateway = marketDataGateway;
        this.accountGateway = accountGateway;
        this.marketConditionClassifier = marketConditionClassifier;
        this.strategySelector = strategySelector;
        this.strategyCatalog = strategyCatalog;
        this.correlationManager = correlationManager;
        this.positionSizer = positionSizer;
        this.spreadTracker = spreadTracker;
        this.riskLedger = riskLedger;
        this.tradeLifecycleManager = tradeLifecycleManager;
        this.tradingSessionFilter = tradingSessionFilter;
        this.orchestrationConfig = orchestrationConfig;
        this.tradingExecutor = tradingExecutor;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.tradingEnabled = new AtomicBoolean(orchestrationConfig.isTradingEnabledOnStartup());
        this.riskAppetite = orchestrationConfig.getDefaultRiskAppetite();
        for (CycleOutcome outcome : CycleOutcome.values()) {
            outcomeCounts.put(outcome, new AtomicLong());
        }
    }

    // ========================
    // CYCLE
    // ========================

    @Scheduled(
            fixedDelayString = "${regimetrader.orchestration.cycle-interval-ms:60000}",
            initialDelayString = "${regimetrader.orchestration.initial-delay-ms:5000}")
    public void runCycle() {
        Instant now = clock.instant();
        long cycle = cycleCount.incrementAndGet();
        riskLedger.rollDayIfNeeded();
        markEquity();

        List<Instrument> instruments = instrumentRegistry.getInstruments();
        List<CompletableFuture<Void>> workers = new ArrayList<>();
        for (Instrument instrument : instruments) {
            workers.add(CompletableFuture.runAsync(() -> processInstrument(instrument, now), tradingExecutor));
        }

        try {
            CompletableFuture.allOf(workers.toArray(new CompletableFuture[0]))
                    .get(orchestrationConfig.getCycleTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            long unfinished = workers.stream().filter(w -> !w.isDone()).count();
            log.warn("Cycle {} timed out after {} with {} workers unfinished", cycle, orchestrationConfig.getCycleTimeout(), unfinished);
        } catch (ExecutionException e) {
            log.error("Cycle {} worker failed", cycle, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Cycle {} interrupted", cycle);
        }
        lastCycleAt = now;
        log.debug("Cycle {} finished for {} instruments", cycle, instruments.size());
    }

    private void markEquity() {
        try {
            AccountInfo accountInfo = accountGateway.getAccountInfo();
            riskLedger.markEquity(accountInfo.getEquity());
        } catch (RuntimeException e) {
            log.warn("Account info unavailable, equity not marked this cycle: {}", e.getMessage());
        }
    }

    /** One instrument's share of the cycle. Never throws; the outcome is recorded. */
    CycleOutcome processInstrument(Instrument instrument, Instant now) {
        String symbol = instrument.getSymbol();
        try {
            return evaluate(instrument, now);
        } catch (RuntimeException e) {
            log.error("Cycle worker for {} failed", symbol, e);
            return record(symbol, CycleOutcome.ERROR, e.getClass().getSimpleName() + ": " + e.getMessage(), null, null);
        }
    }

    private CycleOutcome evaluate(Instrument instrument, Instant now) {
        String symbol = instrument.getSymbol();

        Quote quote;
        try {
            quote = marketDataGateway.getQuote(symbol);
        } catch (RuntimeException e) {
            log.warn("No quote for {}: {}", symbol, e.getMessage());
            return record(symbol, CycleOutcome.DATA_UNAVAILABLE, "quote unavailable: " + e.getMessage(), null, null);
        }
        BigDecimal averageSpread = spreadTracker.averageSpread(symbol).orElse(null);
        spreadTracker.update(symbol, quote.getSpread());

        tradeLifecycleManager.monitor(symbol, quote, now);

        if (!tradingEnabled.get()) {
            return record(symbol, CycleOutcome.CLOSE_ONLY, "trading stopped", null, null);
        }
        if (!instrumentRegistry.isActive(symbol)) {
            return record(symbol, CycleOutcome.INACTIVE, "instrument inactive", null, null);
        }
        if (riskLedger.isCircuitBreakerLatched()) {
            return record(symbol, CycleOutcome.CIRCUIT_BREAKER, riskLedger.getCircuitBreakerState().name(), null, null);
        }
        if (!tradingSessionFilter.isTradingAllowed(instrument, now)) {
            return record(symbol, CycleOutcome.OUTSIDE_SESSION, "no enabled session open", null, null);
        }

        List<Bar> bars;
        try {
            bars = marketDataGateway.getBars(symbol, orchestrationConfig.getBarCount());
        } catch (RuntimeException e) {
            log.warn("No bars for {}: {}", symbol, e.getMessage());
            return record(symbol, CycleOutcome.DATA_UNAVAILABLE, "bars unavailable: " + e.getMessage(), null, null);
        }
        correlationManager.updatePriceHistory(symbol, bars.stream().map(Bar::getClose).toList());
        MarketCondition condition = marketConditionClassifier.classify(instrument, bars);

        for (String positionId : tradeLifecycleManager.positionsNeedingReEvaluation(symbol)) {
            tradeLifecycleManager.reEvaluate(positionId, condition);
        }

        Optional<StrategySelection> selection = strategySelector.select(condition, strategyCatalog, instrument);
        if (selection.isEmpty()) {
            String detail = condition.isDegraded()
                    ? "classification degraded: " + condition.getDegradationReason()
                    : "no strategy for " + condition.getTrend() + " at confidence " + Math.round(condition.getConfidence());
            return record(symbol, CycleOutcome.NO_STRATEGY, detail, condition, null);
        }
        StrategyDefinition strategy = selection.get().strategy();

        if (bars.size() < strategy.getSignalGenerator().requiredBars()) {
            return record(symbol, CycleOutcome.NO_SIGNAL, "insufficient bars for " + strategy.getName(), condition, selection.get());
        }
        Optional<TradeSignal> signal =
                strategy.getSignalGenerator().generate(BarSeriesFactory.toSeries(symbol, bars), condition);
        if (signal.isEmpty()) {
            return record(symbol, CycleOutcome.NO_SIGNAL, strategy.getName() + " has no signal", condition, selection.get());
        }
        TradeSignal tradeSignal = signal.get();

        AdmissionDecision ledgerCheck = riskLedger.checkAdmission(symbol);
        if (!ledgerCheck.admitted()) {
            log.info("Entry on {} not admitted by ledger: {}", symbol, ledgerCheck.reason());
            return record(symbol, CycleOutcome.ADMISSION_REJECTED, ledgerCheck.reason(), condition, selection.get());
        }
        List<Position> active = tradeLifecycleManager.getActivePositions();
        AdmissionDecision correlationCheck = correlationManager.canOpen(symbol, tradeSignal.getDirection(), active);
        if (!correlationCheck.admitted()) {
            log.info("Entry on {} not admitted by correlation check: {}", symbol, correlationCheck.reason());
            return record(symbol, CycleOutcome.ADMISSION_REJECTED, correlationCheck.reason(), condition, selection.get());
        }

        SizingDecision sizing = positionSizer.size(SizingRequest.builder()
                .instrument(instrument)
                .equity(riskLedger.getEquity())
                .tier(riskLedger.currentTier())
                .riskParams(strategy.getRiskParams())
                .direction(tradeSignal.getDirection())
                .entryPrice(quote.entryPrice(tradeSignal.getDirection()))
                .atr(condition.getAtr())
                .structureLevel(tradeSignal.getStructureLevel())
                .currentSpread(quote.getSpread())
                .averageSpread(averageSpread)
                .riskAppetite(riskAppetite)
                .build());
        if (!sizing.isTradeable()) {
            return record(symbol, CycleOutcome.SIZING_REJECTED, sizing.getRejectionReason(), condition, selection.get());
        }

        EntryPlan plan = EntryPlan.builder()
                .instrument(instrument)
                .strategyName(strategy.getName())
                .direction(tradeSignal.getDirection())
                .size(sizing.getSize())
                .referencePrice(quote.entryPrice(tradeSignal.getDirection()))
                .stopLoss(sizing.getStopLossPrice())
                .takeProfits(sizing.getTakeProfits())
                .trailing(sizing.isTrailing())
                .trailingActivationPrice(sizing.getTrailingActivationPrice())
                .trailingDistance(sizing.getTrailingDistance())
                .riskAmount(sizing.getRiskAmount())
                .build();
        TradeDirection direction = tradeSignal.getDirection();
        EntrySubmission submission = tradeLifecycleManager.submitEntry(plan, open -> {
            if (!tradingEnabled.get()) {
                return AdmissionDecision.reject("trading stopped");
            }
            return correlationManager.canOpen(symbol, direction, open);
        });
        if (!submission.isAccepted()) {
            return record(
                    symbol, CycleOutcome.ADMISSION_REJECTED, submission.rejectionReason(), condition, selection.get());
        }
        return record(
                symbol,
                CycleOutcome.ENTRY_SUBMITTED,
                tradeSignal.getDirection() + " " + sizing.getSize() + " via " + strategy.getName() + ": "
                        + tradeSignal.getReason(),
                condition,
                selection.get());
    }

    private CycleOutcome record(
            String symbol, CycleOutcome outcome, String detail, MarketCondition condition, StrategySelection selection) {
        outcomeCounts.get(outcome).incrementAndGet();
        InstrumentStatus previous = statuses.get(symbol);
        statuses.put(
                symbol,
                InstrumentStatus.builder()
                        .symbol(symbol)
                        .active(instrumentRegistry.isActive(symbol))
                        .outcome(outcome)
                        .detail(detail)
                        .condition(condition != null ? condition : previous != null ? previous.getCondition() : null)
                        .selectedStrategy(selection != null ? selection.strategy().getName() : null)
                        .selectionScore(selection != null ? selection.score() : null)
                        .updatedAt(clock.instant())
                        .build());
        log.debug("{}: {} ({})", symbol, outcome, detail);
        return outcome;
    }

    // ========================
    // COMMANDS
    // ========================

    /**
     * Enables new entries, optionally restricting trading to {@code instruments} and changing
     * the risk appetite.
     *
     * @throws CircuitBreakerTrippedException while the circuit breaker is latched
     */
    public void startTrading(List<String> instruments, RiskAppetite appetite) {
        if (riskLedger.isCircuitBreakerLatched()) {
            throw new CircuitBreakerTrippedException(
                    riskLedger.getCircuitBreakerState().name(), "reset the circuit breaker before starting trading");
        }
        if (instruments != null && !instruments.isEmpty()) {
            instrumentRegistry.activateOnly(instruments);
        }
        if (appetite != null) {
            riskAppetite = appetite;
        }
        tradingEnabled.set(true);
        log.info("Trading started (appetite {}, instruments {})", riskAppetite, instruments);
        eventPublisherHelper.publishRisk(
                this, RiskEventType.TRADING_RESUMED, RiskLevel.INFO, "Trading started with " + riskAppetite + " risk");
    }

    /**
     * Halts new entries. Open positions keep being monitored and closed. No entry is committed
     * after this returns, including ones from workers already past their close-only check.
     */
    public void stopTrading() {
        tradingEnabled.set(false);
        tradeLifecycleManager.awaitCommittingEntries();
        log.warn("Trading stopped; close-only mode");
        eventPublisherHelper.publishRisk(
                this, RiskEventType.TRADING_HALTED, RiskLevel.WARNING, "Trading stopped by operator");
    }

    public void toggleInstrument(String symbol, boolean active) {
        instrumentRegistry.setActive(symbol, active);
        InstrumentStatus previous = statuses.get(symbol);
        if (previous != null) {
            statuses.put(symbol, previous.toBuilder().active(active).build());
        }
    }

    // ========================
    // STATUS
    // ========================

    public boolean isTradingEnabled() {
        return tradingEnabled.get();
    }

    public RiskAppetite getRiskAppetite() {
        return riskAppetite;
    }

    public long getCycleCount() {
        return cycleCount.get();
    }

    /** Number of instrument evaluations that ended with {@code outcome} since startup. */
    public long getOutcomeCount(CycleOutcome outcome) {
        return outcomeCounts.get(outcome).get();
    }

    public Instant getLastCycleAt() {
        return lastCycleAt;
    }

    /** Latest status per instrument, in configuration order. */
    public List<InstrumentStatus> getInstrumentStatuses() {
        List<InstrumentStatus> result = new ArrayList<>();
        for (Instrument instrument : instrumentRegistry.getInstruments()) {
            String symbol = instrument.getSymbol();
            InstrumentStatus status = statuses.get(symbol);
            result.add(status != null
                    ? status
                    : InstrumentStatus.builder()
                            .symbol(symbol)
                            .active(instrumentRegistry.isActive(symbol))
                            .outcome(CycleOutcome.IDLE)
                            .build());
        }
        return result;
    }
}
