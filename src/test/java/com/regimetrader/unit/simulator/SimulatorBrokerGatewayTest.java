package com.regimetrader.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.regimetrader.broker.ExecutionResult;
import com.regimetrader.broker.ExecutionStatus;
import com.regimetrader.broker.OpenPositionRequest;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.AccountInfo;
import com.regimetrader.domain.model.Bar;
import com.regimetrader.domain.model.Quote;
import com.regimetrader.exception.ResourceNotFoundException;
import com.regimetrader.instrument.InstrumentRegistry;
import com.regimetrader.simulator.SimulatorBrokerGateway;
import com.regimetrader.simulator.SimulatorConfig;
import com.regimetrader.unit.TestBars;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SimulatorBrokerGatewayTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-04T10:00:00Z"), ZoneOffset.UTC);

    private InstrumentRegistry instrumentRegistry;
    private SimulatorConfig config;

    @BeforeEach
    void setUp() {
        instrumentRegistry = new InstrumentRegistry(
                List.of(TestBars.eurusd(), TestBars.synthetic("Volatility 75 Index")),
                List.of("EURUSD", "Volatility 75 Index"));
        config = new SimulatorConfig();
        config.setHistoryBars(100);
    }

    private SimulatorBrokerGateway gateway() {
        return new SimulatorBrokerGateway(config, instrumentRegistry, CLOCK);
    }

    private static OpenPositionRequest request(String id, TradeDirection direction) {
        return OpenPositionRequest.builder()
                .positionId(id)
                .symbol("EURUSD")
                .direction(direction)
                .size(new BigDecimal("0.10"))
                .strategyName("test")
                .build();
    }

    private static ExecutionResult await(CompletableFuture<ExecutionResult> future)
            throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("Market data")
    class MarketData {

        @Test
        @DisplayName("history is seeded with well-formed bars in time order")
        void seededHistory() {
            List<Bar> bars = gateway().getBars("EURUSD", 500);

            assertThat(bars).hasSize(100);
            for (int i = 0; i < bars.size(); i++) {
                Bar bar = bars.get(i);
                assertThat(bar.getHigh()).isGreaterThanOrEqualTo(Math.max(bar.getOpen(), bar.getClose()));
                assertThat(bar.getLow()).isLessThanOrEqualTo(Math.min(bar.getOpen(), bar.getClose()));
                if (i > 0) {
                    assertThat(bar.getOpenTime()).isAfter(bars.get(i - 1).getOpenTime());
                }
            }
        }

        @Test
        @DisplayName("each quote advances the market by one bar")
        void quoteAdvances() {
            SimulatorBrokerGateway gateway = gateway();
            Bar before = gateway.getBars("EURUSD", 1).get(0);

            Quote quote = gateway.getQuote("EURUSD");

            Bar after = gateway.getBars("EURUSD", 1).get(0);
            assertThat(after.getOpenTime()).isAfter(before.getOpenTime());
            assertThat(quote.getAsk()).isGreaterThan(quote.getBid());
        }

        @Test
        @DisplayName("the same seed reproduces the same market")
        void deterministicSeed() {
            List<Bar> first = gateway().getBars("Volatility 75 Index", 20);
            List<Bar> second = gateway().getBars("Volatility 75 Index", 20);

            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("unknown symbols are rejected")
        void unknownSymbol() {
            assertThatThrownBy(() -> gateway().getQuote("XAUUSD")).isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("a buy fills at the ask and its close books P&L to the balance")
        void openAndClose() throws Exception {
            SimulatorBrokerGateway gateway = gateway();
            Quote quote = gateway.getQuote("EURUSD");

            ExecutionResult open = await(gateway.openPosition(request("p1", TradeDirection.LONG)));

            assertThat(open.isFilled()).isTrue();
            assertThat(open.price()).isEqualByComparingTo(quote.getAsk());

            ExecutionResult close = await(gateway.closePosition("p1", new BigDecimal("0.10")));

            assertThat(close.isFilled()).isTrue();
            assertThat(close.price()).isEqualByComparingTo(quote.getBid());
            AccountInfo account = gateway.getAccountInfo();
            // one spread lost on a round trip at an unchanged quote
            BigDecimal expected = quote.getBid().subtract(quote.getAsk())
                    .divide(new BigDecimal("0.0001"))
                    .multiply(BigDecimal.TEN)
                    .multiply(new BigDecimal("0.10"));
            assertThat(account.getBalance()).isEqualByComparingTo(new BigDecimal("10000").add(expected));
            assertThat(account.getEquity()).isEqualByComparingTo(account.getBalance());
        }

        @Test
        @DisplayName("a partial close leaves the remainder open")
        void partialClose() throws Exception {
            SimulatorBrokerGateway gateway = gateway();
            await(gateway.openPosition(request("p1", TradeDirection.SHORT)));

            ExecutionResult partial = await(gateway.closePosition("p1", new BigDecimal("0.04")));
            ExecutionResult rest = await(gateway.closePosition("p1", new BigDecimal("1.00")));

            assertThat(partial.size()).isEqualByComparingTo("0.04");
            assertThat(rest.size()).isEqualByComparingTo("0.06");
            assertThat(await(gateway.closePosition("p1", BigDecimal.ONE)).status())
                    .isEqualTo(ExecutionStatus.REJECTED);
        }

        @Test
        @DisplayName("closing an unknown position is rejected")
        void unknownPosition() throws Exception {
            ExecutionResult result = await(gateway().closePosition("missing", BigDecimal.ONE));

            assertThat(result.status()).isEqualTo(ExecutionStatus.REJECTED);
        }

        @Test
        @DisplayName("configured rejection probability is injected")
        void injectedRejection() throws Exception {
            config.setRejectProbability(1.0);

            ExecutionResult result = await(gateway().openPosition(request("p1", TradeDirection.LONG)));

            assertThat(result.status()).isEqualTo(ExecutionStatus.REJECTED);
        }

        @Test
        @DisplayName("configured timeout probability is injected and opens nothing")
        void injectedTimeout() throws Exception {
            config.setTimeoutProbability(1.0);
            SimulatorBrokerGateway gateway = gateway();

            ExecutionResult result = await(gateway.openPosition(request("p1", TradeDirection.LONG)));

            assertThat(result.status()).isEqualTo(ExecutionStatus.TIMEOUT);
            config.setTimeoutProbability(0.0);
            assertThat(await(gateway.closePosition("p1", BigDecimal.ONE)).status())
                    .isEqualTo(ExecutionStatus.REJECTED);
        }

        @Test
        @DisplayName("replaying an open with the same id does not double the position")
        void idempotentOpen() throws Exception {
            SimulatorBrokerGateway gateway = gateway();
            ExecutionResult first = await(gateway.openPosition(request("p1", TradeDirection.LONG)));
            gateway.getQuote("EURUSD");

            ExecutionResult replay = await(gateway.openPosition(request("p1", TradeDirection.LONG)));

            assertThat(replay.price()).isEqualByComparingTo(first.price());
            assertThat(await(gateway.closePosition("p1", BigDecimal.ONE)).size()).isEqualByComparingTo("0.10");
        }
    }
}
