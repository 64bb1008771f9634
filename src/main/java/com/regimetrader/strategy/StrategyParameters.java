package com.regimetrader.strategy;

/**
 * Typed signal parameters, one record per strategy kind. Built from configuration by
 * {@link StrategyKind#parse} and validated there; nothing reads raw parameter maps at runtime.
 */
public sealed interface StrategyParameters {

    record MaCross(int fastPeriod, int slowPeriod) implements StrategyParameters {
        static MaCross read(ParameterReader reader) {
            int fast = reader.intValue("fast_period", 9, 1);
            int slow = reader.intValue("slow_period", 21, 2);
            if (fast >= slow) {
                throw new IllegalStateException("fast_period must be below slow_period");
            }
            return new MaCross(fast, slow);
        }
    }

    record MaRsiCombo(int fastPeriod, int slowPeriod, int rsiPeriod, double oversold, double overbought)
            implements StrategyParameters {
        static MaRsiCombo read(ParameterReader reader) {
            int fast = reader.intValue("fast_period", 20, 1);
            int slow = reader.intValue("slow_period", 50, 2);
            int rsi = reader.intValue("rsi_period", 14, 2);
            double oversold = reader.doubleValue("rsi_oversold", 30, 0, 100);
            double overbought = reader.doubleValue("rsi_overbought", 70, 0, 100);
            if (fast >= slow || oversold >= overbought) {
                throw new IllegalStateException("ma_rsi parameters need fast < slow and oversold < overbought");
            }
            return new MaRsiCombo(fast, slow, rsi, oversold, overbought);
        }
    }

    record StochasticCross(int kPeriod, int dPeriod, double oversold, double overbought)
            implements StrategyParameters {
        static StochasticCross read(ParameterReader reader) {
            int k = reader.intValue("k_period", 14, 2);
            int d = reader.intValue("d_period", 3, 1);
            double oversold = reader.doubleValue("oversold", 20, 0, 100);
            double overbought = reader.doubleValue("overbought", 80, 0, 100);
            if (oversold >= overbought) {
                throw new IllegalStateException("stochastic oversold must be below overbought");
            }
            return new StochasticCross(k, d, oversold, overbought);
        }
    }

    /**
     * @param rangeBars          bars forming the level that gets broken
     * @param maxBarsSinceBreak  how many bars back the break may have happened
     * @param retestToleranceAtr how close to the level (in ATRs) the retest must come
     */
    record BreakAndRetest(int rangeBars, int maxBarsSinceBreak, double retestToleranceAtr)
            implements StrategyParameters {
        static BreakAndRetest read(ParameterReader reader) {
            return new BreakAndRetest(
                    reader.intValue("range_bars", 20, 3),
                    reader.intValue("max_bars_since_break", 5, 1),
                    reader.doubleValue("retest_tolerance_atr", 0.5, 0, 5));
        }
    }

    /** @param swingStrength bars on each side a swing point must exceed */
    record BreakOfStructure(int swingStrength, int lookbackBars) implements StrategyParameters {
        static BreakOfStructure read(ParameterReader reader) {
            int swing = reader.intValue("swing_strength", 3, 1);
            int lookback = reader.intValue("lookback_bars", 30, 5);
            if (lookback <= swing * 2) {
                throw new IllegalStateException("lookback_bars must exceed twice swing_strength");
            }
            return new BreakOfStructure(swing, lookback);
        }
    }

    record FairValueGap(double minGapAtr, int maxGapAgeBars) implements StrategyParameters {
        static FairValueGap read(ParameterReader reader) {
            return new FairValueGap(
                    reader.doubleValue("min_gap_atr", 0.3, 0, 10), reader.intValue("max_gap_age_bars", 10, 3));
        }
    }

    record JHook(int trendPeriod, int impulseBars, int pullbackBars, double minImpulseAtr, double maxPullbackRatio)
            implements StrategyParameters {
        static JHook read(ParameterReader reader) {
            return new JHook(
                    reader.intValue("trend_period", 50, 2),
                    reader.intValue("impulse_bars", 10, 2),
                    reader.intValue("pullback_bars", 5, 1),
                    reader.doubleValue("min_impulse_atr", 2.0, 0, 20),
                    reader.doubleValue("max_pullback_ratio", 0.618, 0.05, 1.0));
        }
    }
}
