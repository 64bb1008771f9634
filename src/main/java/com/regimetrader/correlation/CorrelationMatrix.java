package com.regimetrader.correlation;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of measured correlations, one entry per unordered pair. Replaced wholesale
 * on refresh so readers never see a half-built matrix.
 */
public final class CorrelationMatrix {

    private static final CorrelationMatrix EMPTY = new CorrelationMatrix(Map.of(), null);

    private final Map<String, CorrelationEntry> entries;
    private final Instant computedAt;

    private CorrelationMatrix(Map<String, CorrelationEntry> entries, Instant computedAt) {
        this.entries = entries;
        this.computedAt = computedAt;
    }

    public static CorrelationMatrix empty() {
        return EMPTY;
    }

    public static CorrelationMatrix of(Collection<CorrelationEntry> entries, Instant computedAt) {
        Map<String, CorrelationEntry> byKey = new LinkedHashMap<>();
        for (CorrelationEntry entry : entries) {
            if (entry.instrumentA().equals(entry.instrumentB())) {
                continue;
            }
            byKey.put(CorrelationEntry.key(entry.instrumentA(), entry.instrumentB()), entry);
        }
        return new CorrelationMatrix(Collections.unmodifiableMap(byKey), computedAt);
    }

    public Optional<CorrelationEntry> get(String a, String b) {
        return Optional.ofNullable(entries.get(CorrelationEntry.key(a, b)));
    }

    public Collection<CorrelationEntry> entries() {
        return entries.values();
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    public int size() {
        return entries.size();
    }
}
