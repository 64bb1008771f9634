package com.regimetrader.strategy;

import java.util.Map;

/**
 * Winner of a selection round plus every eligible strategy's score, for the dashboard.
 */
public record StrategySelection(StrategyDefinition strategy, double score, Map<String, Double> allScores) {}
