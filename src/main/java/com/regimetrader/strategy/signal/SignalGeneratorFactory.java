package com.regimetrader.strategy.signal;

import com.regimetrader.strategy.StrategyParameters;

/**
 * Maps typed strategy parameters to their signal generator.
 */
public final class SignalGeneratorFactory {

    private SignalGeneratorFactory() {}

    public static SignalGenerator create(StrategyParameters parameters) {
        if (parameters instanceof StrategyParameters.MaCross p) {
            return new MaCrossSignal(p);
        }
        if (parameters instanceof StrategyParameters.MaRsiCombo p) {
            return new MaRsiComboSignal(p);
        }
        if (parameters instanceof StrategyParameters.StochasticCross p) {
            return new StochasticCrossSignal(p);
        }
        if (parameters instanceof StrategyParameters.BreakAndRetest p) {
            return new BreakAndRetestSignal(p);
        }
        if (parameters instanceof StrategyParameters.BreakOfStructure p) {
            return new BreakOfStructureSignal(p);
        }
        if (parameters instanceof StrategyParameters.FairValueGap p) {
            return new FairValueGapSignal(p);
        }
        if (parameters instanceof StrategyParameters.JHook p) {
            return new JHookSignal(p);
        }
        throw new IllegalArgumentException("No signal generator for " + parameters);
    }
}
