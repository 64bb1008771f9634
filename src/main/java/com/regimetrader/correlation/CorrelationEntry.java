package com.regimetrader.correlation;

import java.time.Instant;

/**
 * Measured correlation of one unordered instrument pair. {@code instrumentA} sorts before
 * {@code instrumentB}.
 */
public record CorrelationEntry(String instrumentA, String instrumentB, double coefficient, Instant lastUpdated) {

    public static String key(String a, String b) {
        return a.compareTo(b) <= 0 ? a + "|" + b : b + "|" + a;
    }
}
