package com.regimetrader.strategy;

import com.regimetrader.domain.enums.InstrumentClass;
import com.regimetrader.strategy.signal.SignalGenerator;
import java.util.Map;
import java.util.Set;
import lombok.Builder;
import lombok.Value;

/**
 * A named, read-only catalog entry: suitability weights per regime bucket (0-10), risk
 * parameters and the signal generator built from its typed parameters.
 */
@Value
@Builder
public class StrategyDefinition {

    String name;
    StrategyKind kind;
    boolean enabled;

    /** Position in the catalog; lower wins score ties. */
    int declarationOrder;

    Map<RegimeKey, Double> weights;
    RiskParams riskParams;
    StrategyParameters parameters;
    SignalGenerator signalGenerator;

    /** Symbols the strategy may trade; empty means all. */
    Set<String> symbols;

    /** Additive score bonus per instrument class. */
    Map<InstrumentClass, Double> affinity;

    public double weight(RegimeKey key) {
        return weights.getOrDefault(key, 0.0);
    }

    public double affinityFor(InstrumentClass instrumentClass) {
        if (affinity == null || instrumentClass == null) {
            return 0.0;
        }
        return affinity.getOrDefault(instrumentClass, 0.0);
    }

    public boolean appliesTo(String symbol) {
        return symbols == null || symbols.isEmpty() || symbols.contains(symbol);
    }
}
