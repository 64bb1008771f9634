package com.regimetrader.strategy;

import com.regimetrader.domain.enums.InstrumentClass;
import com.regimetrader.strategy.StrategyCatalogConfig.StopLossProperties;
import com.regimetrader.strategy.StrategyCatalogConfig.StrategyProperties;
import com.regimetrader.strategy.StrategyCatalogConfig.TakeProfitProperties;
import com.regimetrader.strategy.signal.SignalGeneratorFactory;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Immutable, ordered registry of strategy variants, loaded once at startup.
 *
 * <p>Loading validates every entry: names are unique, weights lie in [0, 10] under known regime
 * keys, stop/take-profit specs and signal parameters convert into their typed forms. Any problem
 * fails startup with an {@link IllegalStateException}.
 *
 * <p>Missing middle buckets are derived explicitly: MEDIUM_VOLATILITY and MEDIUM_LIQUIDITY default
 * to the mean of their LOW and HIGH weights, NEUTRAL_MARKET to the mean of BULLISH and BEARISH.
 */
@Component
public class StrategyCatalog {

    private static final Logger log = LoggerFactory.getLogger(StrategyCatalog.class);

    private final List<StrategyDefinition> strategies;

    @Autowired
    public StrategyCatalog(StrategyCatalogConfig config) {
        this(load(config));
    }

    public StrategyCatalog(List<StrategyDefinition> strategies) {
        Set<String> names = new HashSet<>();
        for (StrategyDefinition strategy : strategies) {
            if (!names.add(strategy.getName())) {
                throw new IllegalStateException("Duplicate strategy name: " + strategy.getName());
            }
        }
        this.strategies = List.copyOf(strategies);
        log.info("Strategy catalog loaded with {} strategies: {}", this.strategies.size(), names());
    }

    /** All strategies in declaration order. */
    public List<StrategyDefinition> getStrategies() {
        return strategies;
    }

    public List<StrategyDefinition> getEnabledStrategies() {
        return strategies.stream().filter(StrategyDefinition::isEnabled).toList();
    }

    public Optional<StrategyDefinition> find(String name) {
        return strategies.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    public List<String> names() {
        return strategies.stream().map(StrategyDefinition::getName).toList();
    }

    // ========================
    // LOADING
    // ========================

    static List<StrategyDefinition> load(StrategyCatalogConfig config) {
        List<StrategyDefinition> definitions = new ArrayList<>();
        int order = 0;
        for (StrategyProperties properties : config.getStrategies()) {
            definitions.add(toDefinition(properties, order++));
        }
        return definitions;
    }

    static StrategyDefinition toDefinition(StrategyProperties properties, int order) {
        String name = properties.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalStateException("Strategy at position " + order + " has no name");
        }
        if (properties.getKind() == null) {
            throw new IllegalStateException("Strategy '" + name + "' has no kind");
        }
        try {
            StrategyParameters parameters =
                    properties.getKind().parse(new ParameterReader(name, properties.getParameters()));
            RiskParams riskParams = new RiskParams(
                    toStopLoss(properties.getStopLoss()),
                    toTakeProfit(properties.getTakeProfit(), properties.getRiskRewardRatio()),
                    properties.getRiskRewardRatio(),
                    properties.getMaxSpreadPips());
            if (!(riskParams.maxSpreadPips() > 0)) {
                throw new IllegalStateException("max-spread-pips must be > 0");
            }
            return StrategyDefinition.builder()
                    .name(name)
                    .kind(properties.getKind())
                    .enabled(properties.isEnabled())
                    .declarationOrder(order)
                    .weights(toWeights(name, properties.getWeights()))
                    .riskParams(riskParams)
                    .parameters(parameters)
                    .signalGenerator(SignalGeneratorFactory.create(parameters))
                    .symbols(Collections.unmodifiableSet(new LinkedHashSet<>(properties.getSymbols())))
                    .affinity(toAffinity(name, properties.getAffinity()))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Strategy '" + name + "' is misconfigured: " + e.getMessage(), e);
        }
    }

    private static Map<RegimeKey, Double> toWeights(String name, Map<String, Double> raw) {
        Map<RegimeKey, Double> weights = new EnumMap<>(RegimeKey.class);
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            RegimeKey key = RegimeKey.fromConfigKey(entry.getKey())
                    .orElseThrow(() -> new IllegalStateException(
                            "Strategy '" + name + "' has unknown weight key '" + entry.getKey() + "'"));
            double value = entry.getValue() != null ? entry.getValue() : 0.0;
            if (!(value >= 0 && value <= 10)) {
                throw new IllegalStateException(
                        "Strategy '" + name + "' weight " + entry.getKey() + " must be within [0, 10]");
            }
            weights.put(key, value);
        }
        deriveMiddle(name, weights, RegimeKey.MEDIUM_VOLATILITY, RegimeKey.LOW_VOLATILITY, RegimeKey.HIGH_VOLATILITY);
        deriveMiddle(name, weights, RegimeKey.MEDIUM_LIQUIDITY, RegimeKey.LOW_LIQUIDITY, RegimeKey.HIGH_LIQUIDITY);
        deriveMiddle(name, weights, RegimeKey.NEUTRAL_MARKET, RegimeKey.BULLISH_MARKET, RegimeKey.BEARISH_MARKET);
        return Collections.unmodifiableMap(weights);
    }

    private static void deriveMiddle(
            String name, Map<RegimeKey, Double> weights, RegimeKey middle, RegimeKey first, RegimeKey second) {
        if (weights.containsKey(middle) || !weights.containsKey(first) || !weights.containsKey(second)) {
            return;
        }
        double derived = (weights.get(first) + weights.get(second)) / 2.0;
        weights.put(middle, derived);
        log.info("Strategy '{}': {} not configured, derived {} from {} and {}", name, middle, derived, first, second);
    }

    private static Map<InstrumentClass, Double> toAffinity(String name, Map<String, Double> raw) {
        Map<InstrumentClass, Double> affinity = new EnumMap<>(InstrumentClass.class);
        for (Map.Entry<String, Double> entry : raw.entrySet()) {
            try {
                affinity.put(InstrumentClass.valueOf(entry.getKey().toUpperCase(Locale.ROOT)), entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                        "Strategy '" + name + "' has unknown affinity class '" + entry.getKey() + "'", e);
            }
        }
        return Collections.unmodifiableMap(affinity);
    }

    private static StopLossSpec toStopLoss(StopLossProperties properties) {
        return switch (properties.getType().toUpperCase(Locale.ROOT)) {
            case "FIXED" -> new StopLossSpec.FixedPips(properties.getPips());
            case "ATR" -> new StopLossSpec.AtrMultiple(properties.getAtrMultiplier());
            case "STRUCTURE" -> new StopLossSpec.StructureBuffer(properties.getBufferPips());
            default -> throw new IllegalArgumentException("unknown stop-loss type " + properties.getType());
        };
    }

    private static TakeProfitSpec toTakeProfit(TakeProfitProperties properties, double riskRewardRatio) {
        return switch (properties.getType().toUpperCase(Locale.ROOT)) {
            case "FIXED" -> new TakeProfitSpec.FixedRiskReward(
                    properties.getRatio() != null ? properties.getRatio() : riskRewardRatio);
            case "MULTIPLE" -> new TakeProfitSpec.MultipleTargets(
                    properties.getTp1Ratio(), properties.getTp2Ratio(), properties.getTp1Fraction());
            case "TRAILING" -> new TakeProfitSpec.Trailing(properties.getActivationRatio(), properties.getTrailPips());
            default -> throw new IllegalArgumentException("unknown take-profit type " + properties.getType());
        };
    }
}
