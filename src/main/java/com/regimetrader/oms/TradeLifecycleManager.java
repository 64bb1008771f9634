package com.regimetrader.oms;

import com.regimetrader.broker.ExecutionGateway;
import com.regimetrader.broker.ExecutionResult;
import com.regimetrader.broker.ExecutionStatus;
import com.regimetrader.broker.OpenPositionRequest;
import com.regimetrader.domain.enums.CloseReason;
import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.enums.TrendState;
import com.regimetrader.domain.model.MarketCondition;
import com.regimetrader.domain.model.Position;
import com.regimetrader.domain.model.Quote;
import com.regimetrader.domain.model.TakeProfitLevel;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.PositionEventType;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.event.RiskLevel;
import com.regimetrader.exception.BusinessException;
import com.regimetrader.exception.ErrorCode;
import com.regimetrader.exception.ExecutionFatalException;
import com.regimetrader.exception.ExecutionTimeoutException;
import com.regimetrader.exception.ResourceNotFoundException;
import com.regimetrader.risk.AdmissionDecision;
import com.regimetrader.risk.LedgerDecision;
import com.regimetrader.risk.RiskLedger;
import com.regimetrader.service.PositionArchiveService;
import jakarta.annotation.PostConstruct;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Owns every position from entry submission to close.
 *
 * <p>Positions move PENDING_ENTRY -> OPEN -> CLOSING -> CLOSED (see {@link PositionStateMachine}).
 * Risk is committed in the {@link RiskLedger} before any order goes out and released on every
 * path that ends without a fill.
 *
 * <p><b>Execution:</b> broker calls are asynchronous. Every future is bounded by
 * {@code order-timeout}; failed attempts are retried with exponential backoff on
 * {@link CompletableFuture#delayedExecutor}, so no thread ever blocks waiting for the broker.
 * A close that exhausts its retries marks the position execution-fatal, raises a risk event and
 * makes one more at-market attempt; if that fails too the position stays CLOSING and
 * {@link #monitor} retries it on the next cycle.
 *
 * <p><b>Thread safety:</b> the position index is a ConcurrentHashMap; each position's state is
 * guarded by its own monitor, taken both by the cycle workers and by execution callbacks.
 * Entries additionally serialize on one lock from admission check to registration.
 * Everything returned to callers is a copy.
 */
@Service
public class TradeLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(TradeLifecycleManager.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private final ExecutionGateway executionGateway;
    private final RiskLedger riskLedger;
    private final PositionArchiveService positionArchiveService;
    private final EventPublisherHelper eventPublisherHelper;
    private final LifecycleConfig lifecycleConfig;
    private final Clock clock;

    /** Non-terminal positions by id. */
    private final Map<String, Position> positions = new ConcurrentHashMap<>();

    private final Deque<Position> recentlyClosed = new ConcurrentLinkedDeque<>();

    /** Serializes entry admission against the set of active positions. */
    private final ReentrantLock entryLock = new ReentrantLock();

    public TradeLifecycleManager(
            ExecutionGateway executionGateway,
            RiskLedger riskLedger,
            PositionArchiveService positionArchiveService,
            EventPublisherHelper eventPublisherHelper,
            LifecycleConfig lifecycleConfig,
            Clock clock) {
        this.executionGateway = executionGateway;
        this.riskLedger = riskLedger;
        this.positionArchiveService = positionArchiveService;
        this.eventPublisherHelper = eventPublisherHelper;
        this.lifecycleConfig = lifecycleConfig;
        this.clock = clock;
    }

    @PostConstruct
    void validateConfig() {
        lifecycleConfig.validate();
    }

    // ========================
    // ENTRY
    // ========================

    /**
     * Runs the admission check, commits the plan's risk and sends the entry order. The check, the
     * ledger commit and the registration of the position happen under one lock, so concurrent
     * entries see each other. Nothing is sent when the check or the ledger refuses.
     */
    public EntrySubmission submitEntry(EntryPlan plan, EntryAdmission admission) {
        Instant now = clock.instant();
        Position position = Position.builder()
                .id(UUID.randomUUID().toString())
                .instrument(plan.getInstrument().getSymbol())
                .strategyName(plan.getStrategyName())
                .direction(plan.getDirection())
                .entryPrice(plan.getReferencePrice())
                .size(plan.getSize())
                .originalSize(plan.getSize())
                .stopLoss(plan.getStopLoss())
                .takeProfits(copyLevels(plan.getTakeProfits()))
                .trailingEnabled(plan.isTrailing())
                .trailingActivationPrice(plan.getTrailingActivationPrice())
                .trailingDistance(plan.getTrailingDistance())
                .riskAmount(plan.getRiskAmount())
                .pipSize(plan.getInstrument().getPipSize())
                .pipValuePerLot(plan.getInstrument().getPipValuePerLot())
                .status(PositionStatus.PENDING_ENTRY)
                .createdAt(now)
                .build();

        entryLock.lock();
        try {
            AdmissionDecision admitted = admission.check(getActivePositions());
            if (!admitted.admitted()) {
                log.info("Entry on {} refused at commit: {}", position.getInstrument(), admitted.reason());
                return EntrySubmission.rejected(admitted.reason());
            }
            LedgerDecision decision = riskLedger.recordOpen(position);
            if (!decision.committed()) {
                log.info("Entry on {} refused by risk ledger: {}", position.getInstrument(), decision.reason());
                return EntrySubmission.rejected(decision.reason());
            }
            positions.put(position.getId(), position);
        } finally {
            entryLock.unlock();
        }

        log.info(
                "Entry submitted: {} {} {} lots of {} (strategy {}, stop {}, risk {})",
                position.getId(),
                position.getDirection(),
                position.getSize(),
                position.getInstrument(),
                position.getStrategyName(),
                position.getStopLoss(),
                position.getRiskAmount());
        eventPublisherHelper.publishPosition(this, position, PositionEventType.ENTRY_SUBMITTED);

        OpenPositionRequest request = OpenPositionRequest.builder()
                .positionId(position.getId())
                .symbol(position.getInstrument())
                .direction(position.getDirection())
                .size(position.getSize())
                .stopLoss(position.getStopLoss())
                .strategyName(position.getStrategyName())
                .build();
        Position snapshot;
        synchronized (position) {
            snapshot = position.copy();
        }
        attemptOpen(position, request, 1);
        return EntrySubmission.accepted(snapshot);
    }

    /**
     * Returns once every entry that already passed its admission check has been committed, so a
     * flag set before this call is seen by every later check.
     */
    public void awaitCommittingEntries() {
        entryLock.lock();
        entryLock.unlock();
    }

    private void attemptOpen(Position position, OpenPositionRequest request, int attempt) {
        bounded(() -> executionGateway.openPosition(request))
                .whenComplete((result, error) -> onOpenResult(position, request, attempt, result, error));
    }

    private void onOpenResult(
            Position position, OpenPositionRequest request, int attempt, ExecutionResult result, Throwable error) {
        synchronized (position) {
            if (position.getStatus() != PositionStatus.PENDING_ENTRY) {
                log.warn("Ignoring late open result for {} in status {}", position.getId(), position.getStatus());
                return;
            }
            if (result != null && result.isFilled()) {
                onEntryFilled(position, result);
                return;
            }
            if (result != null && result.status() == ExecutionStatus.REJECTED) {
                failEntry(position, "entry rejected: " + result.reason());
                return;
            }

            String failure = describeFailure(result, error);
            position.setLastError(failure);
            if (attempt < lifecycleConfig.getRetryAttempts()) {
                long delay = backoffMillis(attempt);
                log.warn(
                        "Open attempt {}/{} for {} failed ({}), retrying in {} ms",
                        attempt,
                        lifecycleConfig.getRetryAttempts(),
                        position.getId(),
                        failure,
                        delay);
                CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS)
                        .execute(() -> attemptOpen(position, request, attempt + 1));
                return;
            }

            ExecutionTimeoutException timeout = new ExecutionTimeoutException(position.getId(), "open");
            log.error("Entry for {} failed after {} attempts: {}", position.getId(), attempt, failure, timeout);
            publishExecutionFatal(position, "open", attempt, failure);
            closeOrphanFill(position);
            failEntry(position, "entry timed out after " + attempt + " attempts");
        }
    }

    private void onEntryFilled(Position position, ExecutionResult result) {
        Instant now = clock.instant();
        PositionStateMachine.transition(position, PositionStatus.OPEN);
        position.setEntryPrice(result.price());
        if (result.size() != null && result.size().signum() > 0) {
            position.setSize(result.size());
            position.setOriginalSize(result.size());
        }
        position.setOpenedAt(now);
        position.setAgeingDeadline(now.plus(lifecycleConfig.getPositionAging()));
        position.setReEvaluationDeadline(now.plus(lifecycleConfig.getReEvaluationInterval()));
        position.setLastError(null);
        log.info(
                "Position {} OPEN: {} {} {} @ {}",
                position.getId(),
                position.getDirection(),
                position.getSize(),
                position.getInstrument(),
                position.getEntryPrice());
        eventPublisherHelper.publishPosition(this, position, PositionEventType.OPENED);
    }

    /** Best-effort close for a fill the broker may have made after we stopped waiting. */
    private void closeOrphanFill(Position position) {
        String positionId = position.getId();
        bounded(() -> executionGateway.closePosition(positionId, position.getSize()))
                .whenComplete((result, error) -> {
                    if (result != null && result.isFilled()) {
                        log.warn("Closed orphan fill for failed entry {} @ {}", positionId, result.price());
                    } else {
                        log.info("No orphan fill closed for {}: {}", positionId, describeFailure(result, error));
                    }
                });
    }

    private void failEntry(Position position, String reason) {
        PositionStateMachine.transition(position, PositionStatus.CLOSED);
        position.setCloseReason(CloseReason.ENTRY_FAILED);
        position.setClosedAt(clock.instant());
        position.setLastError(reason);
        positions.remove(position.getId());
        riskLedger.release(position);
        rememberClosed(position);
        log.warn("Entry {} on {} failed: {}", position.getId(), position.getInstrument(), reason);
        eventPublisherHelper.publishPosition(this, position, PositionEventType.ENTRY_FAILED);
    }

    // ========================
    // MONITORING
    // ========================

    /**
     * Applies one quote to every position on the instrument: stop-loss, take-profit targets,
     * trailing stop, ageing and re-evaluation deadlines. Stuck closes are retried here.
     */
    public void monitor(String instrument, Quote quote, Instant now) {
        for (Position position : positions.values()) {
            if (!position.getInstrument().equals(instrument)) {
                continue;
            }
            synchronized (position) {
                switch (position.getStatus()) {
                    case OPEN -> monitorOpen(position, quote, now);
                    case CLOSING -> retryStuckClose(position);
                    default -> {
                        // PENDING_ENTRY waits for its fill; CLOSED is never indexed
                    }
                }
            }
        }
    }

    private void monitorOpen(Position position, Quote quote, Instant now) {
        TradeDirection direction = position.getDirection();
        BigDecimal exit = quote.exitPrice(direction);

        // the stop applies even while a partial take-profit is in flight
        if (position.getStopLoss() != null && !isBeyond(exit, position.getStopLoss(), direction)) {
            log.info("Stop-loss hit on {}: {} vs stop {}", position.getId(), exit, position.getStopLoss());
            requestClose(position, CloseReason.STOP_LOSS);
            return;
        }

        if (position.isCloseInFlight()) {
            return;
        }

        if (checkTakeProfits(position, exit)) {
            return;
        }

        if (position.isTrailingEnabled()) {
            trailStop(position, exit);
        }

        if (position.getAgeingDeadline() != null && !now.isBefore(position.getAgeingDeadline())) {
            log.info("Position {} reached its ageing deadline", position.getId());
            requestClose(position, CloseReason.AGED);
            return;
        }

        if (position.getReEvaluationDeadline() != null
                && !now.isBefore(position.getReEvaluationDeadline())
                && !position.isNeedsReEvaluation()) {
            position.setNeedsReEvaluation(true);
            log.debug("Position {} flagged for re-evaluation", position.getId());
        }
    }

    /** Returns true when a close (partial or full) was started. */
    private boolean checkTakeProfits(Position position, BigDecimal exit) {
        List<TakeProfitLevel> pending = position.getTakeProfits().stream()
                .filter(level -> !level.isHit())
                .toList();
        if (pending.isEmpty()) {
            return false;
        }
        TakeProfitLevel next = pending.get(0);
        if (!isBeyond(exit, next.getPrice(), position.getDirection()) && exit.compareTo(next.getPrice()) != 0) {
            return false;
        }
        BigDecimal closeSize = next.getFraction()
                .multiply(position.getOriginalSize())
                .setScale(position.getOriginalSize().scale(), RoundingMode.DOWN);
        if (pending.size() == 1 || closeSize.compareTo(position.getSize()) >= 0 || closeSize.signum() <= 0) {
            log.info("Final take-profit hit on {} at {}", position.getId(), exit);
            next.setHit(true);
            requestClose(position, CloseReason.TAKE_PROFIT);
        } else {
            log.info("Partial take-profit hit on {} at {}: closing {}", position.getId(), exit, closeSize);
            partialClose(position, next, closeSize, 1);
        }
        return true;
    }

    private void trailStop(Position position, BigDecimal exit) {
        TradeDirection direction = position.getDirection();
        if (position.getTrailingActivationPrice() != null
                && isBeyond(position.getTrailingActivationPrice(), exit, direction)) {
            return;
        }
        BigDecimal candidate = exit.subtract(position.getTrailingDistance().multiply(BigDecimal.valueOf(direction.sign())));
        if (position.getStopLoss() == null || isBeyond(candidate, position.getStopLoss(), direction)) {
            position.setStopLoss(candidate);
            eventPublisherHelper.publishPosition(this, position, PositionEventType.STOP_ADJUSTED);
        }
    }

    // ========================
    // RE-EVALUATION
    // ========================

    /** Ids of open positions on the instrument whose re-evaluation deadline has passed. */
    public List<String> positionsNeedingReEvaluation(String instrument) {
        List<String> ids = new ArrayList<>();
        for (Position position : positions.values()) {
            synchronized (position) {
                if (position.getInstrument().equals(instrument)
                        && position.getStatus() == PositionStatus.OPEN
                        && position.isNeedsReEvaluation()) {
                    ids.add(position.getId());
                }
            }
        }
        return ids;
    }

    /**
     * Closes the position with STRATEGY_REVERSAL when the regime turned against it; otherwise
     * clears the flag and schedules the next re-evaluation. Returns true when a close started.
     */
    public boolean reEvaluate(String positionId, MarketCondition condition) {
        Position position = positions.get(positionId);
        if (position == null) {
            return false;
        }
        synchronized (position) {
            if (position.getStatus() != PositionStatus.OPEN || position.isCloseInFlight()) {
                return false;
            }
            boolean reversed = (position.getDirection() == TradeDirection.LONG
                            && condition.getTrend() == TrendState.BEARISH)
                    || (position.getDirection() == TradeDirection.SHORT && condition.getTrend() == TrendState.BULLISH);
            if (reversed) {
                log.info("Regime turned {} against {} position {}", condition.getTrend(), position.getDirection(), positionId);
                requestClose(position, CloseReason.STRATEGY_REVERSAL);
                return true;
            }
            position.setNeedsReEvaluation(false);
            position.setReEvaluationDeadline(clock.instant().plus(lifecycleConfig.getReEvaluationInterval()));
            return false;
        }
    }

    // ========================
    // MANUAL COMMANDS
    // ========================

    public Position closeManually(String positionId) {
        Position position = positions.get(positionId);
        if (position == null) {
            throw new ResourceNotFoundException("Position", positionId);
        }
        synchronized (position) {
            if (position.getStatus() != PositionStatus.OPEN) {
                throw new BusinessException(
                        ErrorCode.CONFLICT, "Position " + positionId + " is " + position.getStatus() + ", not OPEN");
            }
            requestClose(position, CloseReason.MANUAL);
            return position.copy();
        }
    }

    /** Starts a close for every OPEN position. Returns how many closes were started. */
    public int closeAll(CloseReason reason) {
        int started = 0;
        for (Position position : positions.values()) {
            synchronized (position) {
                if (position.getStatus() == PositionStatus.OPEN) {
                    requestClose(position, reason);
                    started++;
                }
            }
        }
        log.warn("Close-all ({}) started {} closes", reason, started);
        return started;
    }

    // ========================
    // CLOSING
    // ========================

    private void requestClose(Position position, CloseReason reason) {
        PositionStateMachine.transition(position, PositionStatus.CLOSING);
        position.setCloseReason(reason);
        position.setNeedsReEvaluation(false);
        eventPublisherHelper.publishPosition(this, position, PositionEventType.CLOSING);
        attemptClose(position, 1);
    }

    private void retryStuckClose(Position position) {
        if (position.isExecutionFatal() && !position.isCloseInFlight()) {
            log.warn("Retrying close of execution-fatal position {}", position.getId());
            attemptClose(position, 1);
        }
    }

    private void attemptClose(Position position, int attempt) {
        position.setCloseInFlight(true);
        BigDecimal size = position.getSize();
        bounded(() -> executionGateway.closePosition(position.getId(), size))
                .whenComplete((result, error) -> onCloseResult(position, attempt, result, error));
    }

    private void onCloseResult(Position position, int attempt, ExecutionResult result, Throwable error) {
        synchronized (position) {
            if (position.getStatus() != PositionStatus.CLOSING) {
                return;
            }
            if (result != null && result.isFilled()) {
                completeClose(position, result);
                return;
            }
            String failure = describeFailure(result, error);
            position.setLastError(failure);
            if (attempt < lifecycleConfig.getRetryAttempts()) {
                long delay = backoffMillis(attempt);
                log.warn(
                        "Close attempt {}/{} for {} failed ({}), retrying in {} ms",
                        attempt,
                        lifecycleConfig.getRetryAttempts(),
                        position.getId(),
                        failure,
                        delay);
                CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS).execute(() -> {
                    synchronized (position) {
                        if (position.getStatus() == PositionStatus.CLOSING) {
                            attemptClose(position, attempt + 1);
                        }
                    }
                });
                return;
            }

            if (!position.isExecutionFatal()) {
                position.setExecutionFatal(true);
                ExecutionFatalException fatal =
                        new ExecutionFatalException(position.getId(), "close", attempt, failure);
                log.error("Close of {} exhausted {} attempts", position.getId(), attempt, fatal);
                publishExecutionFatal(position, "close", attempt, failure);
            }
            attemptMarketClose(position);
        }
    }

    /** Last attempt after retries are exhausted; a failure leaves the position CLOSING for the next cycle. */
    private void attemptMarketClose(Position position) {
        BigDecimal size = position.getSize();
        bounded(() -> executionGateway.closePosition(position.getId(), size))
                .whenComplete((result, error) -> {
                    synchronized (position) {
                        if (position.getStatus() != PositionStatus.CLOSING) {
                            return;
                        }
                        if (result != null && result.isFilled()) {
                            completeClose(position, result);
                            return;
                        }
                        position.setCloseInFlight(false);
                        position.setLastError(describeFailure(result, error));
                        log.error(
                                "At-market close of {} failed ({}); will retry next cycle",
                                position.getId(),
                                position.getLastError());
                    }
                });
    }

    private void completeClose(Position position, ExecutionResult result) {
        BigDecimal pnl = realizedPnl(position, result.price(), position.getSize());
        position.setExitPrice(result.price());
        position.setRealizedPnl(position.getRealizedPnl().add(pnl));
        position.setClosedAt(clock.instant());
        position.setCloseInFlight(false);
        PositionStateMachine.transition(position, PositionStatus.CLOSED);
        positions.remove(position.getId());

        riskLedger.recordClose(position, pnl);
        positionArchiveService.archive(position.copy());
        rememberClosed(position);
        log.info(
                "Position {} CLOSED ({}) @ {}: realized {}",
                position.getId(),
                position.getCloseReason(),
                position.getExitPrice(),
                position.getRealizedPnl());
        eventPublisherHelper.publishPosition(this, position, PositionEventType.CLOSED);
    }

    private void partialClose(Position position, TakeProfitLevel level, BigDecimal closeSize, int attempt) {
        position.setCloseInFlight(true);
        bounded(() -> executionGateway.closePosition(position.getId(), closeSize))
                .whenComplete((result, error) -> {
                    synchronized (position) {
                        if (position.getStatus() == PositionStatus.CLOSED) {
                            return;
                        }
                        if (result != null && result.isFilled()) {
                            onPartialFilled(position, level, result);
                            return;
                        }
                        if (position.getStatus() != PositionStatus.OPEN) {
                            // a full close took over; its own attempt owns closeInFlight
                            return;
                        }
                        String failure = describeFailure(result, error);
                        position.setLastError(failure);
                        if (attempt < lifecycleConfig.getRetryAttempts()) {
                            CompletableFuture.delayedExecutor(backoffMillis(attempt), TimeUnit.MILLISECONDS)
                                    .execute(() -> {
                                        synchronized (position) {
                                            if (position.getStatus() == PositionStatus.OPEN) {
                                                partialClose(position, level, closeSize, attempt + 1);
                                            }
                                        }
                                    });
                            return;
                        }
                        position.setCloseInFlight(false);
                        log.warn(
                                "Partial close of {} failed after {} attempts ({}); target stays pending",
                                position.getId(),
                                attempt,
                                failure);
                    }
                });
    }

    private void onPartialFilled(Position position, TakeProfitLevel level, ExecutionResult result) {
        BigDecimal closed = result.size() != null ? result.size() : BigDecimal.ZERO;
        BigDecimal pnl = realizedPnl(position, result.price(), closed);
        level.setHit(true);
        position.setSize(position.getSize().subtract(closed));
        position.setRealizedPnl(position.getRealizedPnl().add(pnl));
        position.setRiskAmount(scaledRisk(position, closed));
        riskLedger.recordPartialClose(position, closed, pnl);
        log.info(
                "Partial close of {}: {} @ {} (pnl {}), {} remaining",
                position.getId(),
                closed,
                result.price(),
                pnl,
                position.getSize());
        eventPublisherHelper.publishPosition(this, position, PositionEventType.PARTIALLY_CLOSED);
        if (position.getStatus() != PositionStatus.OPEN) {
            return;
        }
        position.setCloseInFlight(false);

        if (lifecycleConfig.isBreakevenAfterFirstTarget()
                && position.getStopLoss() != null
                && isBeyond(position.getEntryPrice(), position.getStopLoss(), position.getDirection())) {
            position.setStopLoss(position.getEntryPrice());
            log.info("Stop of {} moved to breakeven {}", position.getId(), position.getEntryPrice());
            eventPublisherHelper.publishPosition(this, position, PositionEventType.STOP_ADJUSTED);
        }
    }

    // ========================
    // QUERIES
    // ========================

    /** Copies of all non-terminal positions, oldest first. */
    public List<Position> getActivePositions() {
        List<Position> result = new ArrayList<>();
        for (Position position : positions.values()) {
            synchronized (position) {
                result.add(position.copy());
            }
        }
        result.sort(Comparator.comparing(Position::getCreatedAt));
        return result;
    }

    public List<Position> getActivePositions(String instrument) {
        return getActivePositions().stream()
                .filter(p -> p.getInstrument().equals(instrument))
                .toList();
    }

    /** Recently closed positions, newest first. */
    public List<Position> getRecentlyClosed() {
        return List.copyOf(recentlyClosed);
    }

    public Optional<Position> findPosition(String positionId) {
        Position active = positions.get(positionId);
        if (active != null) {
            synchronized (active) {
                return Optional.of(active.copy());
            }
        }
        return recentlyClosed.stream().filter(p -> p.getId().equals(positionId)).findFirst();
    }

    // ========================
    // HELPERS
    // ========================

    /** (exit - entry) * sign / pipSize * pipValue * size, rounded to cents. */
    static BigDecimal realizedPnl(Position position, BigDecimal exitPrice, BigDecimal size) {
        return exitPrice.subtract(position.getEntryPrice())
                .multiply(BigDecimal.valueOf(position.getDirection().sign()))
                .divide(position.getPipSize(), MC)
                .multiply(position.getPipValuePerLot())
                .multiply(size)
                .setScale(2, RoundingMode.HALF_UP);
    }

    /** True when {@code price} is strictly on the favourable side of {@code reference}. */
    private static boolean isBeyond(BigDecimal price, BigDecimal reference, TradeDirection direction) {
        int cmp = price.compareTo(reference);
        return direction == TradeDirection.LONG ? cmp > 0 : cmp < 0;
    }

    private static BigDecimal scaledRisk(Position position, BigDecimal closed) {
        if (position.getRiskAmount() == null || position.getOriginalSize().signum() <= 0) {
            return position.getRiskAmount();
        }
        BigDecimal remainingShare = BigDecimal.ONE.subtract(closed.divide(position.getSize().add(closed), MC));
        return position.getRiskAmount().multiply(remainingShare, MC).max(BigDecimal.ZERO);
    }

    private CompletableFuture<ExecutionResult> bounded(Supplier<CompletableFuture<ExecutionResult>> call) {
        CompletableFuture<ExecutionResult> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.orTimeout(lifecycleConfig.getOrderTimeout().toMillis(), TimeUnit.MILLISECONDS);
    }

    private long backoffMillis(int attempt) {
        return lifecycleConfig.getRetryDelay().toMillis() * (1L << Math.min(attempt - 1, 10));
    }

    private static String describeFailure(ExecutionResult result, Throwable error) {
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (cause instanceof TimeoutException) {
                return "no broker response within timeout";
            }
            return cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
        if (result == null) {
            return "no result";
        }
        return result.status() + (result.reason() != null ? ": " + result.reason() : "");
    }

    private void publishExecutionFatal(Position position, String operation, int attempts, String failure) {
        eventPublisherHelper.publishRisk(
                this,
                RiskEventType.EXECUTION_FATAL,
                RiskLevel.CRITICAL,
                "Execution fatal on position " + position.getId() + " (" + operation + ")",
                Map.of(
                        "positionId",
                        position.getId(),
                        "instrument",
                        position.getInstrument(),
                        "operation",
                        operation,
                        "attempts",
                        attempts,
                        "lastError",
                        failure));
    }

    private void rememberClosed(Position position) {
        recentlyClosed.addFirst(position.copy());
        while (recentlyClosed.size() > lifecycleConfig.getRecentClosedLimit()) {
            recentlyClosed.pollLast();
        }
    }

    private static List<TakeProfitLevel> copyLevels(List<TakeProfitLevel> levels) {
        List<TakeProfitLevel> copies = new ArrayList<>();
        if (levels != null) {
            for (TakeProfitLevel level : levels) {
                copies.add(level.toBuilder().hit(false).build());
            }
        }
        return copies;
    }
}
