package com.regimetrader.strategy;

import com.regimetrader.analysis.ClassifierConfig;
import com.regimetrader.domain.enums.TrendState;
import com.regimetrader.domain.model.Instrument;
import com.regimetrader.domain.model.MarketCondition;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Service;

/**
 * Picks the catalog strategy best suited to a classified regime.
 *
 * <p>score = sum over axes of axisWeight * strategy weight for the condition's bucket on that
 * axis, plus the strategy's affinity for the instrument class. Axis weights are the classifier's
 * condition weighting (price action weights the direction axis). The highest score wins; equal
 * scores go to the strategy declared first. Pure: no state, no side effects.
 */
@Service
public class StrategySelector {

    private final ClassifierConfig classifierConfig;
    private final StrategyCatalogConfig catalogConfig;

    public StrategySelector(ClassifierConfig classifierConfig, StrategyCatalogConfig catalogConfig) {
        this.classifierConfig = classifierConfig;
        this.catalogConfig = catalogConfig;
    }

    /**
     * Returns the selected strategy, or empty when the regime is not tradeable (UNKNOWN trend or
     * confidence under the floor) or no eligible strategy scores above the minimum.
     */
    public Optional<StrategySelection> select(MarketCondition condition, StrategyCatalog catalog, Instrument instrument) {
        if (condition.getTrend() == TrendState.UNKNOWN
                || condition.getConfidence() < classifierConfig.getMinTradingConfidence()) {
            return Optional.empty();
        }

        Map<RegimeAxis, RegimeKey> buckets = RegimeKey.bucketsOf(condition);
        Map<RegimeAxis, Double> axisWeights = axisWeights();

        StrategyDefinition best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        Map<String, Double> allScores = new LinkedHashMap<>();
        for (StrategyDefinition strategy : catalog.getEnabledStrategies()) {
            if (!strategy.appliesTo(instrument.getSymbol())) {
                continue;
            }
            double score = score(strategy, buckets, axisWeights) + strategy.affinityFor(instrument.getInstrumentClass());
            allScores.put(strategy.getName(), score);
            // strict comparison keeps the earlier declaration on ties
            if (score > bestScore) {
                best = strategy;
                bestScore = score;
            }
        }

        if (best == null || bestScore <= catalogConfig.getMinStrategyScore()) {
            return Optional.empty();
        }
        return Optional.of(new StrategySelection(best, bestScore, allScores));
    }

    static double score(
            StrategyDefinition strategy, Map<RegimeAxis, RegimeKey> buckets, Map<RegimeAxis, Double> axisWeights) {
        double score = 0.0;
        for (Map.Entry<RegimeAxis, RegimeKey> bucket : buckets.entrySet()) {
            score += axisWeights.getOrDefault(bucket.getKey(), 0.0) * strategy.weight(bucket.getValue());
        }
        return score;
    }

    private Map<RegimeAxis, Double> axisWeights() {
        ClassifierConfig.ConditionWeighting weighting = classifierConfig.getConditionWeighting();
        Map<RegimeAxis, Double> weights = new EnumMap<>(RegimeAxis.class);
        weights.put(RegimeAxis.TREND, weighting.getTrend());
        weights.put(RegimeAxis.VOLATILITY, weighting.getVolatility());
        weights.put(RegimeAxis.LIQUIDITY, weighting.getLiquidity());
        weights.put(RegimeAxis.DIRECTION, weighting.getPriceAction());
        return weights;
    }
}
