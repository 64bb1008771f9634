package com.regimetrader.risk;

import com.regimetrader.domain.enums.CircuitBreakerState;
import com.regimetrader.domain.model.AccountTier;
import com.regimetrader.domain.model.Position;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.event.RiskLevel;
import com.regimetrader.sizing.AccountTierTable;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Account-wide risk state: equity, high-water mark, daily realized P&L, open risk per position
 * and the circuit breakers.
 *
 * <p>The ledger is a plain owned object. {@code RiskConfig} creates the application instance and
 * hands it to its collaborators; tests build isolated instances directly.
 *
 * <p><b>Thread safety:</b> every read and mutation runs under one {@link ReentrantLock}, so an
 * admission check and the commit it guards are a single atomic step in {@link #recordOpen}.
 * Risk events raised by a mutation are published after the lock is released.
 *
 * <p><b>Breakers:</b>
 * <ul>
 *   <li>Daily loss: trips when daily realized P&L &lt;= -maxDailyRisk * day-start equity and stays
 *       latched until the UTC date changes.</li>
 *   <li>Drawdown: trips when drawdown from the high-water mark reaches maxDrawdownPercent. Clears
 *       when drawdown recovers to maxDrawdownPercent - hysteresis, or on manual reset.</li>
 * </ul>
 */
public class RiskLedger {

    private static final Logger log = LoggerFactory.getLogger(RiskLedger.class);

    private static final MathContext MC = MathContext.DECIMAL64;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final RiskLimits limits;
    private final AccountTierTable tierTable;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, OpenRisk> openRisks = new LinkedHashMap<>();

    private LocalDate tradingDay;
    private BigDecimal equity;
    private BigDecimal dayStartEquity;
    private BigDecimal highWaterMark;
    private BigDecimal drawdownPercent = BigDecimal.ZERO;
    private BigDecimal dailyRealizedPnl = BigDecimal.ZERO;
    private boolean dailyLossTripped;
    private boolean drawdownTripped;

    /** Maps an instrument to the group its open risk is aggregated under. */
    private volatile UnaryOperator<String> riskGroupResolver = UnaryOperator.identity();

    public RiskLedger(
            RiskLimits limits,
            AccountTierTable tierTable,
            EventPublisherHelper eventPublisherHelper,
            Clock clock,
            BigDecimal initialEquity) {
        limits.validate();
        this.limits = limits;
        this.tierTable = tierTable;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
        this.tradingDay = LocalDate.now(clock);
        this.equity = initialEquity;
        this.dayStartEquity = initialEquity;
        this.highWaterMark = initialEquity;
        log.info("Risk ledger initialized: equity {}, limits {}", initialEquity, limits);
    }

    public void setRiskGroupResolver(UnaryOperator<String> riskGroupResolver) {
        this.riskGroupResolver = riskGroupResolver;
    }

    // ========================
    // ADMISSION
    // ========================

    public boolean canAdmitNewTrade(String instrument) {
        return checkAdmission(instrument).admitted();
    }

    /** Same as {@link #canAdmitNewTrade} with the reason for a refusal. */
    public AdmissionDecision checkAdmission(String instrument) {
        return locked(events -> {
            rollDayIfNeededLocked(events);
            return admissionLocked(instrument);
        });
    }

    /**
     * Re-checks admission and the daily risk budget, then commits the position's risk
     * contribution. Nothing is committed when the decision is a rejection.
     */
    public LedgerDecision recordOpen(Position position) {
        return locked(events -> {
            rollDayIfNeededLocked(events);
            if (openRisks.containsKey(position.getId())) {
                return LedgerDecision.rejected("position " + position.getId() + " already recorded");
            }
            AdmissionDecision admission = admissionLocked(position.getInstrument());
            if (!admission.admitted()) {
                return LedgerDecision.rejected(admission.reason());
            }
            BigDecimal risk = nonNegative(position.getRiskAmount());
            BigDecimal committed = openRiskLocked().add(realizedLossLocked()).add(risk);
            BigDecimal budget = dailyRiskBudgetLocked();
            if (committed.compareTo(budget) > 0) {
                return LedgerDecision.rejected("DAILY_RISK_BUDGET: committed " + committed.round(MC)
                        + " would exceed " + budget.round(MC));
            }
            openRisks.put(position.getId(), new OpenRisk(position.getInstrument(), position.getSize(), risk));
            log.debug("Recorded open {} on {} with risk {}", position.getId(), position.getInstrument(), risk);
            return LedgerDecision.committed(openRiskLocked());
        });
    }

    // ========================
    // CLOSES
    // ========================

    /** Reduces the position's risk in proportion to the closed size and books the realized P&L. */
    public void recordPartialClose(Position position, BigDecimal closedSize, BigDecimal realizedPnl) {
        locked(events -> {
            OpenRisk open = openRisks.get(position.getId());
            if (open == null) {
                log.warn("Partial close for unknown position {}", position.getId());
            } else if (open.size.signum() > 0) {
                BigDecimal fraction = closedSize.divide(open.size, MC).min(BigDecimal.ONE);
                open.risk = nonNegative(open.risk.subtract(open.risk.multiply(fraction, MC)));
                open.size = nonNegative(open.size.subtract(closedSize));
            }
            bookRealizedLocked(realizedPnl, events);
            return null;
        });
    }

    /**
     * Removes the position's risk, books the final realized P&L against the daily loss limit and
     * recomputes drawdown. Equity is not adjusted here: the broker mark already carries this P&L
     * as floating, so only {@link #markEquity} moves equity.
     */
    public void recordClose(Position position, BigDecimal realizedPnl) {
        locked(events -> {
            if (openRisks.remove(position.getId()) == null) {
                log.warn("Close recorded for position {} that held no ledger risk", position.getId());
            }
            bookRealizedLocked(realizedPnl, events);
            return null;
        });
    }

    /** Releases a position's risk without P&L; used when an entry never filled. */
    public void release(Position position) {
        locked(events -> {
            if (openRisks.remove(position.getId()) != null) {
                log.debug("Released ledger risk for {}", position.getId());
            }
            return null;
        });
    }

    // ========================
    // EQUITY & DAY BOUNDARY
    // ========================

    /** Sets equity to the broker's balance plus floating P&L. The only source of equity and drawdown. */
    public void markEquity(BigDecimal markedEquity) {
        if (markedEquity == null) {
            return;
        }
        locked(events -> {
            equity = markedEquity;
            updateDrawdownLocked(events);
            return null;
        });
    }

    /** Starts a new trading day when the UTC date has changed. Returns true when it did. */
    public boolean rollDayIfNeeded() {
        return locked(this::rollDayIfNeededLocked);
    }

    /**
     * Clears the drawdown breaker and rebases the high-water mark to the current equity.
     * The daily-loss latch is untouched; it clears at the next UTC date.
     */
    public RiskLedgerSnapshot resetCircuitBreaker(String actor) {
        return locked(events -> {
            boolean wasTripped = drawdownTripped;
            drawdownTripped = false;
            highWaterMark = equity;
            drawdownPercent = BigDecimal.ZERO;
            log.warn("Circuit breaker reset by {} (drawdown latch was {})", actor, wasTripped ? "set" : "clear");
            events.add(new PendingEvent(
                    RiskEventType.CIRCUIT_BREAKER_RESET,
                    RiskLevel.WARNING,
                    "Circuit breaker manually reset by " + actor,
                    Map.of("actor", actor, "dailyLossLatched", dailyLossTripped)));
            return snapshotLocked();
        });
    }

    // ========================
    // READS
    // ========================

    public RiskLedgerSnapshot snapshot() {
        return locked(events -> snapshotLocked());
    }

    public CircuitBreakerState getCircuitBreakerState() {
        return locked(events -> breakerStateLocked());
    }

    public boolean isCircuitBreakerLatched() {
        return getCircuitBreakerState() != CircuitBreakerState.ARMED;
    }

    public AccountTier currentTier() {
        return locked(events -> tierTable.tierFor(equity));
    }

    public BigDecimal getEquity() {
        return locked(events -> equity);
    }

    // ========================
    // LOCKED INTERNALS
    // ========================

    private <T> T locked(Function<List<PendingEvent>, T> action) {
        List<PendingEvent> events = new ArrayList<>();
        T result;
        lock.lock();
        try {
            result = action.apply(events);
        } finally {
            lock.unlock();
        }
        for (PendingEvent event : events) {
            eventPublisherHelper.publishRisk(this, event.type(), event.level(), event.message(), event.details());
        }
        return result;
    }

    private AdmissionDecision admissionLocked(String instrument) {
        if (dailyLossTripped) {
            return AdmissionDecision.reject("daily loss limit breached");
        }
        if (drawdownTripped) {
            return AdmissionDecision.reject("drawdown circuit breaker latched at " + drawdownPercent + "%");
        }
        AccountTier tier = tierTable.tierFor(equity);
        long onInstrument = openRisks.values().stream()
                .filter(open -> open.instrument.equals(instrument))
                .count();
        if (onInstrument >= tier.getMaxConcurrentTrades()) {
            return AdmissionDecision.reject(instrument + " already has " + onInstrument + " open (tier "
                    + tier.getLabel() + " allows " + tier.getMaxConcurrentTrades() + ")");
        }
        if (limits.getMaxOpenPositions() != null && openRisks.size() >= limits.getMaxOpenPositions()) {
            return AdmissionDecision.reject("max open positions reached: " + openRisks.size());
        }
        return AdmissionDecision.admit();
    }

    private boolean rollDayIfNeededLocked(List<PendingEvent> events) {
        LocalDate today = LocalDate.now(clock);
        if (!today.isAfter(tradingDay)) {
            return false;
        }
        LocalDate previous = tradingDay;
        BigDecimal previousPnl = dailyRealizedPnl;
        tradingDay = today;
        dayStartEquity = equity;
        dailyRealizedPnl = BigDecimal.ZERO;
        dailyLossTripped = false;
        log.info("Trading day rolled from {} to {}; day-start equity {}", previous, today, equity);
        events.add(new PendingEvent(
                RiskEventType.DAILY_RESET,
                RiskLevel.INFO,
                "Daily risk counters reset for " + today,
                Map.of("previousDay", previous.toString(), "previousDailyPnl", previousPnl, "equity", equity)));
        return true;
    }

    private void bookRealizedLocked(BigDecimal realizedPnl, List<PendingEvent> events) {
        BigDecimal pnl = realizedPnl != null ? realizedPnl : BigDecimal.ZERO;
        dailyRealizedPnl = dailyRealizedPnl.add(pnl);
        updateDrawdownLocked(events);

        BigDecimal lossLimit = dayStartEquity.multiply(limits.getMaxDailyRisk()).negate();
        if (!dailyLossTripped && dailyRealizedPnl.compareTo(lossLimit) <= 0) {
            dailyLossTripped = true;
            log.error("Daily loss limit breached: {} <= {}", dailyRealizedPnl, lossLimit);
            events.add(new PendingEvent(
                    RiskEventType.DAILY_LOSS_LIMIT_BREACH,
                    RiskLevel.CRITICAL,
                    "Daily loss limit breached: " + dailyRealizedPnl,
                    Map.of("dailyRealizedPnl", dailyRealizedPnl, "limit", lossLimit)));
        }
    }

    private void updateDrawdownLocked(List<PendingEvent> events) {
        if (equity.compareTo(highWaterMark) > 0) {
            highWaterMark = equity;
        }
        drawdownPercent = highWaterMark.signum() > 0
                ? highWaterMark.subtract(equity).multiply(HUNDRED).divide(highWaterMark, 4, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;

        if (!drawdownTripped && drawdownPercent.compareTo(limits.getMaxDrawdownPercent()) >= 0) {
            drawdownTripped = true;
            log.error("Drawdown circuit breaker tripped at {}%", drawdownPercent);
            events.add(new PendingEvent(
                    RiskEventType.DRAWDOWN_LIMIT_BREACH,
                    RiskLevel.CRITICAL,
                    "Drawdown limit breached: " + drawdownPercent + "%",
                    Map.of("drawdownPercent", drawdownPercent, "limit", limits.getMaxDrawdownPercent())));
        } else if (drawdownTripped) {
            BigDecimal clearLevel = limits.getMaxDrawdownPercent().subtract(limits.getDrawdownHysteresisPercent());
            if (drawdownPercent.compareTo(clearLevel) <= 0) {
                drawdownTripped = false;
                log.info("Drawdown recovered to {}%, circuit breaker cleared", drawdownPercent);
                events.add(new PendingEvent(
                        RiskEventType.CIRCUIT_BREAKER_RESET,
                        RiskLevel.INFO,
                        "Drawdown recovered to " + drawdownPercent + "%",
                        Map.of("drawdownPercent", drawdownPercent, "clearLevel", clearLevel)));
            }
        }
    }

    private CircuitBreakerState breakerStateLocked() {
        if (drawdownTripped) {
            return CircuitBreakerState.DRAWDOWN_TRIPPED;
        }
        return dailyLossTripped ? CircuitBreakerState.DAILY_LOSS_TRIPPED : CircuitBreakerState.ARMED;
    }

    private RiskLedgerSnapshot snapshotLocked() {
        Map<String, Integer> byInstrument = new TreeMap<>();
        Map<String, BigDecimal> byGroup = new TreeMap<>();
        for (OpenRisk open : openRisks.values()) {
            byInstrument.merge(open.instrument, 1, Integer::sum);
            byGroup.merge(riskGroupResolver.apply(open.instrument), open.risk, BigDecimal::add);
        }
        BigDecimal budget = dailyRiskBudgetLocked();
        BigDecimal remaining = budget.subtract(openRiskLocked()).subtract(realizedLossLocked());
        return RiskLedgerSnapshot.builder()
                .tradingDay(tradingDay)
                .equity(equity)
                .dayStartEquity(dayStartEquity)
                .highWaterMark(highWaterMark)
                .drawdownPercent(drawdownPercent)
                .dailyRealizedPnl(dailyRealizedPnl)
                .openRisk(openRiskLocked())
                .dailyRiskBudget(budget)
                .remainingRiskBudget(nonNegative(remaining))
                .openPositionCount(openRisks.size())
                .openPositionsByInstrument(Collections.unmodifiableMap(byInstrument))
                .openRiskByCorrelationGroup(Collections.unmodifiableMap(byGroup))
                .circuitBreakerState(breakerStateLocked())
                .tripReason(tripReasonLocked())
                .dailyLossTripped(dailyLossTripped)
                .drawdownTripped(drawdownTripped)
                .accountTier(tierTable.tierFor(equity).getLabel())
                .build();
    }

    private String tripReasonLocked() {
        if (drawdownTripped) {
            return "Drawdown " + drawdownPercent + "% reached limit " + limits.getMaxDrawdownPercent() + "%";
        }
        if (dailyLossTripped) {
            return "Daily realized P&L " + dailyRealizedPnl + " reached the daily loss limit";
        }
        return null;
    }

    private BigDecimal openRiskLocked() {
        BigDecimal total = BigDecimal.ZERO;
        for (OpenRisk open : openRisks.values()) {
            total = total.add(open.risk);
        }
        return total;
    }

    private BigDecimal realizedLossLocked() {
        return dailyRealizedPnl.signum() < 0 ? dailyRealizedPnl.negate() : BigDecimal.ZERO;
    }

    private BigDecimal dailyRiskBudgetLocked() {
        return dayStartEquity.multiply(limits.getMaxDailyRisk());
    }

    private static BigDecimal nonNegative(BigDecimal value) {
        if (value == null || value.signum() < 0) {
            return BigDecimal.ZERO;
        }
        return value;
    }

    private static final class OpenRisk {
        private final String instrument;
        private BigDecimal size;
        private BigDecimal risk;

        private OpenRisk(String instrument, BigDecimal size, BigDecimal risk) {
            this.instrument = instrument;
            this.size = size != null ? size : BigDecimal.ZERO;
            this.risk = risk;
        }
    }

    private record PendingEvent(RiskEventType type, RiskLevel level, String message, Map<String, Object> details) {
        private PendingEvent {
            details = new HashMap<>(details);
        }
    }
}
