package com.regimetrader.strategy;

import java.util.function.Function;

/**
 * Signal-generation families available to catalog entries. Several named catalog variants may
 * share one kind with different parameters.
 */
public enum StrategyKind {
    MA_CROSS(StrategyParameters.MaCross::read),
    MA_RSI_COMBO(StrategyParameters.MaRsiCombo::read),
    STOCHASTIC_CROSS(StrategyParameters.StochasticCross::read),
    BREAK_AND_RETEST(StrategyParameters.BreakAndRetest::read),
    BREAK_OF_STRUCTURE(StrategyParameters.BreakOfStructure::read),
    FAIR_VALUE_GAP(StrategyParameters.FairValueGap::read),
    JHOOK(StrategyParameters.JHook::read);

    private final Function<ParameterReader, StrategyParameters> reader;

    StrategyKind(Function<ParameterReader, StrategyParameters> reader) {
        this.reader = reader;
    }

    public StrategyParameters parse(ParameterReader parameterReader) {
        StrategyParameters parameters = reader.apply(parameterReader);
        parameterReader.requireAllConsumed();
        return parameters;
    }
}
