package com.regimetrader.unit.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.regimetrader.domain.enums.CircuitBreakerState;
import com.regimetrader.domain.enums.PositionStatus;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.Position;
import com.regimetrader.event.EventPublisherHelper;
import com.regimetrader.event.RiskEventType;
import com.regimetrader.risk.LedgerDecision;
import com.regimetrader.risk.RiskLedger;
import com.regimetrader.risk.RiskLedgerSnapshot;
import com.regimetrader.risk.RiskLimits;
import com.regimetrader.sizing.AccountTierTable;
import com.regimetrader.unit.MutableClock;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RiskLedgerTest {

    private static final BigDecimal EQUITY = new BigDecimal("10000");

    @Mock
    private EventPublisherHelper eventPublisherHelper;

    private MutableClock clock;
    private RiskLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-04T10:00:00Z"));
        ledger = newLedger(RiskLimits.builder().build());
    }

    private RiskLedger newLedger(RiskLimits limits) {
        return new RiskLedger(limits, AccountTierTable.defaults(), eventPublisherHelper, clock, EQUITY);
    }

    private static Position position(String id, String instrument, String size, String risk) {
        return Position.builder()
                .id(id)
                .instrument(instrument)
                .direction(TradeDirection.LONG)
                .status(PositionStatus.OPEN)
                .size(new BigDecimal(size))
                .riskAmount(new BigDecimal(risk))
                .build();
    }

    @Nested
    @DisplayName("Drawdown breaker")
    class Drawdown {

        @Test
        @DisplayName("15% drawdown latches and blocks admission")
        void tripsAtLimit() {
            ledger.markEquity(new BigDecimal("8500"));

            assertThat(ledger.canAdmitNewTrade("EURUSD")).isFalse();
            assertThat(ledger.getCircuitBreakerState()).isEqualTo(CircuitBreakerState.DRAWDOWN_TRIPPED);
            assertThat(ledger.snapshot().getTripReason()).startsWith("Drawdown");
            assertThat(ledger.recordOpen(position("p1", "EURUSD", "0.1", "10")).committed()).isFalse();
            verify(eventPublisherHelper).publishRisk(
                    any(), eq(RiskEventType.DRAWDOWN_LIMIT_BREACH), any(), anyString(), anyMap());
        }

        @Test
        @DisplayName("stays latched until drawdown recovers past the hysteresis band")
        void hysteresis() {
            ledger.markEquity(new BigDecimal("8500"));
            ledger.markEquity(new BigDecimal("8800"));

            assertThat(ledger.isCircuitBreakerLatched()).isTrue();

            ledger.markEquity(new BigDecimal("9000"));

            assertThat(ledger.isCircuitBreakerLatched()).isFalse();
            assertThat(ledger.canAdmitNewTrade("EURUSD")).isTrue();
            verify(eventPublisherHelper).publishRisk(
                    any(), eq(RiskEventType.CIRCUIT_BREAKER_RESET), any(), anyString(), anyMap());
        }

        @Test
        @DisplayName("manual reset clears the latch and rebases the high-water mark")
        void manualReset() {
            ledger.markEquity(new BigDecimal("8500"));

            RiskLedgerSnapshot snapshot = ledger.resetCircuitBreaker("test");

            assertThat(snapshot.isDrawdownTripped()).isFalse();
            assertThat(snapshot.getHighWaterMark()).isEqualByComparingTo("8500");
            assertThat(snapshot.getDrawdownPercent()).isEqualByComparingTo("0");
            assertThat(ledger.canAdmitNewTrade("EURUSD")).isTrue();
        }

        @Test
        @DisplayName("drawdown is measured from the highest equity seen")
        void highWaterMark() {
            ledger.markEquity(new BigDecimal("12000"));
            ledger.markEquity(new BigDecimal("10800"));

            RiskLedgerSnapshot snapshot = ledger.snapshot();
            assertThat(snapshot.getHighWaterMark()).isEqualByComparingTo("12000");
            assertThat(snapshot.getDrawdownPercent()).isEqualByComparingTo("10");
            assertThat(snapshot.isDrawdownTripped()).isFalse();
        }
    }

    @Nested
    @DisplayName("Equity source")
    class EquitySource {

        @Test
        @DisplayName("a realized win already in the broker mark does not raise the high-water mark twice")
        void realizedWinNotDoubleCounted() {
            Position winner = position("p1", "EURUSD", "0.1", "100");
            ledger.recordOpen(winner);
            ledger.markEquity(new BigDecimal("10800"));

            ledger.recordClose(winner, new BigDecimal("800"));
            ledger.markEquity(new BigDecimal("10800"));

            RiskLedgerSnapshot snapshot = ledger.snapshot();
            assertThat(snapshot.getHighWaterMark()).isEqualByComparingTo("10800");
            assertThat(snapshot.getDrawdownPercent()).isEqualByComparingTo("0");
            assertThat(snapshot.getDailyRealizedPnl()).isEqualByComparingTo("800");
        }

        @Test
        @DisplayName("a realized loss already in the broker mark does not deepen drawdown")
        void realizedLossNotDoubleCounted() {
            ledger = newLedger(RiskLimits.builder().maxDailyRisk(new BigDecimal("0.20")).build());
            Position loser = position("p1", "EURUSD", "0.1", "100");
            ledger.recordOpen(loser);
            ledger.markEquity(new BigDecimal("9000"));

            ledger.recordClose(loser, new BigDecimal("-1000"));

            RiskLedgerSnapshot snapshot = ledger.snapshot();
            assertThat(snapshot.getEquity()).isEqualByComparingTo("9000");
            assertThat(snapshot.getDrawdownPercent()).isEqualByComparingTo("10");
            assertThat(snapshot.isDrawdownTripped()).isFalse();
            assertThat(snapshot.getCircuitBreakerState()).isEqualTo(CircuitBreakerState.ARMED);
            verify(eventPublisherHelper, never()).publishRisk(
                    any(), eq(RiskEventType.DRAWDOWN_LIMIT_BREACH), any(), anyString(), anyMap());
        }
    }

    @Nested
    @DisplayName("Daily loss breaker")
    class DailyLoss {

        @Test
        @DisplayName("realized loss of 5% of day-start equity trips until the next UTC day")
        void tripsAndRolls() {
            Position losing = position("p1", "EURUSD", "0.1", "400");
            ledger.recordOpen(losing);

            ledger.recordClose(losing, new BigDecimal("-500"));
            ledger.markEquity(new BigDecimal("9500"));

            assertThat(ledger.getCircuitBreakerState()).isEqualTo(CircuitBreakerState.DAILY_LOSS_TRIPPED);
            assertThat(ledger.canAdmitNewTrade("GBPUSD")).isFalse();
            verify(eventPublisherHelper).publishRisk(
                    any(), eq(RiskEventType.DAILY_LOSS_LIMIT_BREACH), any(), anyString(), anyMap());

            ledger.resetCircuitBreaker("test");
            assertThat(ledger.canAdmitNewTrade("GBPUSD")).isFalse();

            clock.advance(Duration.ofDays(1));
            assertThat(ledger.rollDayIfNeeded()).isTrue();

            RiskLedgerSnapshot snapshot = ledger.snapshot();
            assertThat(snapshot.isDailyLossTripped()).isFalse();
            assertThat(snapshot.getDailyRealizedPnl()).isEqualByComparingTo("0");
            assertThat(snapshot.getDayStartEquity()).isEqualByComparingTo("9500");
            assertThat(ledger.canAdmitNewTrade("GBPUSD")).isTrue();
        }

        @Test
        @DisplayName("a smaller loss leaves the breaker armed")
        void belowLimit() {
            Position losing = position("p1", "EURUSD", "0.1", "400");
            ledger.recordOpen(losing);

            ledger.recordClose(losing, new BigDecimal("-499.99"));

            assertThat(ledger.getCircuitBreakerState()).isEqualTo(CircuitBreakerState.ARMED);
            verify(eventPublisherHelper, never()).publishRisk(
                    any(), eq(RiskEventType.DAILY_LOSS_LIMIT_BREACH), any(), anyString(), anyMap());
        }

        @Test
        @DisplayName("no roll within the same UTC date")
        void noRollSameDay() {
            clock.advance(Duration.ofHours(10));

            assertThat(ledger.rollDayIfNeeded()).isFalse();
        }
    }

    @Nested
    @DisplayName("Open risk")
    class OpenRisk {

        @Test
        @DisplayName("entries beyond the daily budget are rejected without committing")
        void budgetRejects() {
            assertThat(ledger.recordOpen(position("p1", "EURUSD", "0.1", "300")).committed()).isTrue();

            LedgerDecision second = ledger.recordOpen(position("p2", "GBPUSD", "0.1", "250"));

            assertThat(second.committed()).isFalse();
            assertThat(second.reason()).startsWith("DAILY_RISK_BUDGET");
            assertThat(ledger.snapshot().getOpenRisk()).isEqualByComparingTo("300");
        }

        @Test
        @DisplayName("realized losses consume the budget")
        void realizedLossCountsAgainstBudget() {
            Position first = position("p1", "EURUSD", "0.1", "300");
            ledger.recordOpen(first);
            ledger.recordClose(first, new BigDecimal("-300"));

            assertThat(ledger.recordOpen(position("p2", "EURUSD", "0.1", "250")).committed()).isFalse();
            assertThat(ledger.recordOpen(position("p3", "EURUSD", "0.1", "200")).committed()).isTrue();
        }

        @Test
        @DisplayName("a position id is recorded once")
        void duplicateId() {
            ledger.recordOpen(position("p1", "EURUSD", "0.1", "50"));

            assertThat(ledger.recordOpen(position("p1", "EURUSD", "0.1", "50")).committed()).isFalse();
        }

        @Test
        @DisplayName("partial close releases risk in proportion to the closed size")
        void partialClose() {
            Position open = position("p1", "EURUSD", "1.0", "100");
            ledger.recordOpen(open);

            ledger.recordPartialClose(open, new BigDecimal("0.5"), new BigDecimal("20"));

            RiskLedgerSnapshot snapshot = ledger.snapshot();
            assertThat(snapshot.getOpenRisk()).isEqualByComparingTo("50");
            assertThat(snapshot.getEquity()).isEqualByComparingTo("10000");
            assertThat(snapshot.getDailyRealizedPnl()).isEqualByComparingTo("20");
        }

        @Test
        @DisplayName("release drops risk without touching P&L")
        void release() {
            Position open = position("p1", "EURUSD", "1.0", "100");
            ledger.recordOpen(open);

            ledger.release(open);

            RiskLedgerSnapshot snapshot = ledger.snapshot();
            assertThat(snapshot.getOpenRisk()).isEqualByComparingTo("0");
            assertThat(snapshot.getOpenPositionCount()).isZero();
            assertThat(snapshot.getEquity()).isEqualByComparingTo("10000");
        }

        @Test
        @DisplayName("open risk is aggregated per correlation group")
        void riskByGroup() {
            ledger.setRiskGroupResolver(symbol -> symbol.endsWith("USD") ? "major_usd_pairs" : symbol);
            ledger.recordOpen(position("p1", "EURUSD", "0.1", "100"));
            ledger.recordOpen(position("p2", "GBPUSD", "0.1", "80"));
            ledger.recordOpen(position("p3", "USDJPY", "0.1", "50"));

            RiskLedgerSnapshot snapshot = ledger.snapshot();

            assertThat(snapshot.getOpenRiskByCorrelationGroup()).hasSize(2);
            assertThat(snapshot.getOpenRiskByCorrelationGroup().get("major_usd_pairs")).isEqualByComparingTo("180");
            assertThat(snapshot.getOpenRiskByCorrelationGroup().get("USDJPY")).isEqualByComparingTo("50");
            assertThat(snapshot.getOpenPositionsByInstrument()).containsEntry("EURUSD", 1);
        }

        @Test
        @DisplayName("the account-wide position cap applies when configured")
        void maxOpenPositions() {
            ledger = newLedger(RiskLimits.builder().maxOpenPositions(1).build());
            ledger.recordOpen(position("p1", "EURUSD", "0.1", "10"));

            assertThat(ledger.checkAdmission("GBPUSD").reason()).contains("max open positions");
        }

        @Test
        @DisplayName("the tier caps concurrent trades per instrument")
        void tierConcurrentCap() {
            ledger = new RiskLedger(
                    RiskLimits.builder().build(), AccountTierTable.defaults(), eventPublisherHelper, clock,
                    new BigDecimal("50"));
            ledger.recordOpen(position("p1", "EURUSD", "0.01", "0.5"));

            assertThat(ledger.canAdmitNewTrade("EURUSD")).isFalse();
            assertThat(ledger.canAdmitNewTrade("GBPUSD")).isTrue();
        }

        @Test
        @DisplayName("concurrent opens and closes never exceed the daily budget")
        void concurrentBudgetHolds() throws Exception {
            BigDecimal budget = EQUITY.multiply(new BigDecimal("0.05"));
            ExecutorService pool = Executors.newFixedThreadPool(8);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger ids = new AtomicInteger();
            AtomicInteger violations = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();
            try {
                for (int t = 0; t < 8; t++) {
                    long seed = t;
                    futures.add(pool.submit(() -> {
                        Random random = new Random(seed);
                        List<Position> mine = new ArrayList<>();
                        start.await();
                        for (int i = 0; i < 200; i++) {
                            if (!mine.isEmpty() && random.nextInt(3) == 0) {
                                ledger.recordClose(mine.remove(random.nextInt(mine.size())), BigDecimal.ZERO);
                            } else {
                                Position p = position(
                                        "p" + ids.incrementAndGet(),
                                        "SYM" + random.nextInt(50),
                                        "0.1",
                                        String.valueOf(1 + random.nextInt(120)));
                                LedgerDecision decision = ledger.recordOpen(p);
                                if (decision.committed()) {
                                    mine.add(p);
                                    if (decision.openRisk().compareTo(budget) > 0) {
                                        violations.incrementAndGet();
                                    }
                                }
                            }
                            if (ledger.snapshot().getOpenRisk().compareTo(budget) > 0) {
                                violations.incrementAndGet();
                            }
                        }
                        return null;
                    }));
                }
                start.countDown();
                for (Future<?> future : futures) {
                    future.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(violations.get()).isZero();
            assertThat(ledger.snapshot().getOpenRisk()).isLessThanOrEqualTo(budget);
        }
    }

    @Test
    @DisplayName("invalid limits are rejected at construction")
    void invalidLimits() {
        RiskLimits bad = RiskLimits.builder().drawdownHysteresisPercent(new BigDecimal("20")).build();

        assertThatThrownBy(() -> newLedger(bad))
                .isInstanceOf(IllegalStateException.class);
    }
}
