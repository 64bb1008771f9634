package com.regimetrader.simulator;

import com.regimetrader.broker.AccountGateway;
import com.regimetrader.broker.ExecutionGateway;
import com.regimetrader.broker.ExecutionResult;
import com.regimetrader.broker.MarketDataGateway;
import com.regimetrader.broker.OpenPositionRequest;
import com.regimetrader.domain.enums.InstrumentClass;
import com.regimetrader.domain.enums.TradeDirection;
import com.regimetrader.domain.model.AccountInfo;
import com.regimetrader.domain.model.Bar;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.domain.model.Quote;
import com.regimetrader.instrument.InstrumentRegistry;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of the market data, execution and account gateways.
 *
 * <p>Each quote request advances the instrument by one synthetic bar, so every orchestration
 * cycle sees a moving market. Fills happen at the current quote (ask for buys, bid for sells) and
 * realized P&L is booked to a virtual balance.
 *
 * <p>Active when {@code regimetrader.broker.mode=SIMULATED}, which is the default.
 */
@Service
@ConditionalOnProperty(prefix = "regimetrader.broker", name = "mode", havingValue = "SIMULATED", matchIfMissing = true)
public class SimulatorBrokerGateway implements MarketDataGateway, ExecutionGateway, AccountGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatorBrokerGateway.class);

    private static final MathContext MC = MathContext.DECIMAL64;

    private final SimulatorConfig simulatorConfig;
    private final InstrumentRegistry instrumentRegistry;
    private final Clock clock;
    private final Random random;
    private final Executor executionExecutor;

    private final Map<String, MarketState> markets = new ConcurrentHashMap<>();
    private final Map<String, SimPosition> positions = new ConcurrentHashMap<>();

    private BigDecimal balance;

    public SimulatorBrokerGateway(SimulatorConfig simulatorConfig, InstrumentRegistry instrumentRegistry, Clock clock) {
        this.simulatorConfig = simulatorConfig;
        this.instrumentRegistry = instrumentRegistry;
        this.clock = clock;
        this.random = new Random(simulatorConfig.getSeed());
        this.balance = simulatorConfig.getInitialBalance();
        this.executionExecutor = CompletableFuture.delayedExecutor(
                simulatorConfig.getLatency().toMillis(), TimeUnit.MILLISECONDS);
        log.info(
                "Simulator broker started: balance {} {}, seed {}",
                balance,
                simulatorConfig.getCurrency(),
                simulatorConfig.getSeed());
    }

    // ========================
    // MARKET DATA
    // ========================

    @Override
    public List<Bar> getBars(String symbol, int count) {
        MarketState market = market(symbol);
        synchronized (market) {
            List<Bar> history = new ArrayList<>(market.history);
            return history.subList(Math.max(0, history.size() - count), history.size());
        }
    }

    @Override
    public Quote getQuote(String symbol) {
        MarketState market = market(symbol);
        synchronized (market) {
            market.advance();
            return market.quote();
        }
    }

    // ========================
    // EXECUTION
    // ========================

    @Override
    public CompletableFuture<ExecutionResult> openPosition(OpenPositionRequest request) {
        return execute(() -> {
            ExecutionResult injected = injectFailure();
            if (injected != null) {
                log.debug("Simulator open {} -> {}", request.getPositionId(), injected.status());
                return injected;
            }
            SimPosition existing = positions.get(request.getPositionId());
            if (existing != null) {
                return ExecutionResult.filled(existing.entryPrice, existing.size);
            }
            Quote quote = currentQuote(request.getSymbol());
            BigDecimal price = quote.entryPrice(request.getDirection());
            positions.put(
                    request.getPositionId(),
                    new SimPosition(request.getSymbol(), request.getDirection(), price, request.getSize()));
            log.debug(
                    "Simulator filled open {} {} {} @ {}",
                    request.getPositionId(),
                    request.getDirection(),
                    request.getSize(),
                    price);
            return ExecutionResult.filled(price, request.getSize());
        });
    }

    @Override
    public CompletableFuture<ExecutionResult> closePosition(String positionId, BigDecimal size) {
        return execute(() -> {
            ExecutionResult injected = injectFailure();
            if (injected != null) {
                log.debug("Simulator close {} -> {}", positionId, injected.status());
                return injected;
            }
            SimPosition position = positions.get(positionId);
            if (position == null) {
                return ExecutionResult.rejected("unknown position " + positionId);
            }
            synchronized (position) {
                BigDecimal closeSize = size.min(position.size);
                BigDecimal price = currentQuote(position.symbol).exitPrice(position.direction);
                BigDecimal pnl = pnl(position, price, closeSize);
                synchronized (this) {
                    balance = balance.add(pnl);
                }
                position.size = position.size.subtract(closeSize);
                if (position.size.signum() <= 0) {
                    positions.remove(positionId);
                }
                log.debug("Simulator filled close {} {} @ {} (pnl {})", positionId, closeSize, price, pnl);
                return ExecutionResult.filled(price, closeSize);
            }
        });
    }

    // ========================
    // ACCOUNT
    // ========================

    @Override
    public AccountInfo getAccountInfo() {
        BigDecimal unrealized = BigDecimal.ZERO;
        for (SimPosition position : positions.values()) {
            synchronized (position) {
                BigDecimal price = currentQuote(position.symbol).exitPrice(position.direction);
                unrealized = unrealized.add(pnl(position, price, position.size));
            }
        }
        BigDecimal currentBalance;
        synchronized (this) {
            currentBalance = balance;
        }
        return AccountInfo.builder()
                .balance(currentBalance)
                .equity(currentBalance.add(unrealized))
                .currency(simulatorConfig.getCurrency())
                .build();
    }

    // ========================
    // INTERNALS
    // ========================

    private CompletableFuture<ExecutionResult> execute(Supplier<ExecutionResult> action) {
        return CompletableFuture.supplyAsync(action, executionExecutor);
    }

    /** Returns a rejection or timeout according to the configured probabilities, otherwise null. */
    private ExecutionResult injectFailure() {
        double roll = random.nextDouble();
        if (roll < simulatorConfig.getRejectProbability()) {
            return ExecutionResult.rejected("simulated rejection");
        }
        if (roll < simulatorConfig.getRejectProbability() + simulatorConfig.getTimeoutProbability()) {
            return ExecutionResult.timeout();
        }
        return null;
    }

    private Quote currentQuote(String symbol) {
        MarketState market = market(symbol);
        synchronized (market) {
            return market.quote();
        }
    }

    private BigDecimal pnl(SimPosition position, BigDecimal exitPrice, BigDecimal size) {
        Instrument instrument = instrumentRegistry.require(position.symbol);
        return exitPrice.subtract(position.entryPrice)
                .multiply(BigDecimal.valueOf(position.direction.sign()))
                .divide(instrument.getPipSize(), MC)
                .multiply(instrument.getPipValuePerLot())
                .multiply(size)
                .setScale(2, RoundingMode.HALF_UP);
    }

    private MarketState market(String symbol) {
        return markets.computeIfAbsent(symbol, this::createMarket);
    }

    private MarketState createMarket(String symbol) {
        Instrument instrument = instrumentRegistry.require(symbol);
        boolean synthetic = instrument.getInstrumentClass().isSynthetic();
        SimulatorConfig.MarketProperties properties =
                simulatorConfig.getMarkets().getOrDefault(symbol, new SimulatorConfig.MarketProperties());
        double startPrice = properties.getStartPrice() != null
                ? properties.getStartPrice()
                : defaultStartPrice(instrument);
        double volatility =
                properties.getVolatility() != null ? properties.getVolatility() : (synthetic ? 0.002 : 0.0004);
        double spreadPips = properties.getSpreadPips() != null ? properties.getSpreadPips() : (synthetic ? 2.0 : 1.0);
        double spread = spreadPips * instrument.getPipSize().doubleValue();

        SyntheticBarGenerator generator = new SyntheticBarGenerator(
                instrument.getInstrumentClass(), symbol, startPrice, volatility, spread, random);
        MarketState market = new MarketState(instrument, generator, spread);
        Instant start = clock.instant().minus(simulatorConfig.getBarDuration().multipliedBy(simulatorConfig.getHistoryBars()));
        market.nextOpenTime = start;
        for (int i = 0; i < simulatorConfig.getHistoryBars(); i++) {
            market.advance();
        }
        log.info("Simulated market for {} seeded at {} ({} bars)", symbol, startPrice, market.history.size());
        return market;
    }

    private static double defaultStartPrice(Instrument instrument) {
        if (instrument.getInstrumentClass() != InstrumentClass.FOREX) {
            return 1000.0;
        }
        // JPY-style quotes use a 0.01 pip
        return instrument.getPipSize().compareTo(new BigDecimal("0.01")) >= 0 ? 150.0 : 1.1;
    }

    private final class MarketState {
        private final Instrument instrument;
        private final SyntheticBarGenerator generator;
        private final BigDecimal halfSpread;
        private final Deque<Bar> history = new ArrayDeque<>();
        private Instant nextOpenTime;

        private MarketState(Instrument instrument, SyntheticBarGenerator generator, double spread) {
            this.instrument = instrument;
            this.generator = generator;
            this.halfSpread = BigDecimal.valueOf(spread / 2);
        }

        private void advance() {
            history.addLast(generator.next(nextOpenTime));
            nextOpenTime = nextOpenTime.plus(simulatorConfig.getBarDuration());
            while (history.size() > simulatorConfig.getHistoryBars()) {
                history.removeFirst();
            }
        }

        private Quote quote() {
            int scale = instrument.getPipSize().scale() + 1;
            BigDecimal mid = BigDecimal.valueOf(generator.lastClose());
            return Quote.builder()
                    .symbol(instrument.getSymbol())
                    .bid(mid.subtract(halfSpread).setScale(scale, RoundingMode.HALF_DOWN))
                    .ask(mid.add(halfSpread).setScale(scale, RoundingMode.HALF_UP))
                    .timestamp(nextOpenTime)
                    .build();
        }
    }

    private static final class SimPosition {
        private final String symbol;
        private final TradeDirection direction;
        private final BigDecimal entryPrice;
        private BigDecimal size;

        private SimPosition(String symbol, TradeDirection direction, BigDecimal entryPrice, BigDecimal size) {
            this.symbol = symbol;
            this.direction = direction;
            this.entryPrice = entryPrice;
            this.size = size;
        }
    }
}
