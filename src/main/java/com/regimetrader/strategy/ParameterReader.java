package com.regimetrader.strategy;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reads a strategy's raw parameter map from configuration into typed values, rejecting keys the
 * strategy kind does not declare.
 */
public final class ParameterReader {

    private final String strategyName;
    private final Map<String, Double> raw;
    private final Set<String> consumed = new HashSet<>();

    public ParameterReader(String strategyName, Map<String, Double> raw) {
        this.strategyName = strategyName;
        this.raw = raw != null ? new HashMap<>(raw) : Map.of();
    }

    public int intValue(String key, int defaultValue, int min) {
        consumed.add(key);
        Double value = raw.get(key);
        int result = value != null ? (int) Math.round(value) : defaultValue;
        if (result < min) {
            throw invalid(key, "must be >= " + min + ", got " + result);
        }
        return result;
    }

    public double doubleValue(String key, double defaultValue, double min, double max) {
        consumed.add(key);
        Double value = raw.get(key);
        double result = value != null ? value : defaultValue;
        if (!Double.isFinite(result) || result < min || result > max) {
            throw invalid(key, "must be within [" + min + ", " + max + "], got " + result);
        }
        return result;
    }

    /** Fails when the map holds keys nothing asked for. */
    public void requireAllConsumed() {
        Set<String> unknown = new HashSet<>(raw.keySet());
        unknown.removeAll(consumed);
        if (!unknown.isEmpty()) {
            throw new IllegalStateException("Strategy '" + strategyName + "' has unknown parameters " + unknown);
        }
    }

    private IllegalStateException invalid(String key, String problem) {
        return new IllegalStateException("Strategy '" + strategyName + "' parameter '" + key + "' " + problem);
    }
}
