package com.regimetrader.strategy;

/**
 * How a strategy takes profit. Ratios are multiples of the stop distance.
 */
public sealed interface TakeProfitSpec {

    record FixedRiskReward(double ratio) implements TakeProfitSpec {
        public FixedRiskReward {
            if (!(ratio > 0)) {
                throw new IllegalArgumentException("risk reward ratio must be > 0, got " + ratio);
            }
        }
    }

    /** Two targets; the first closes {@code tp1Fraction} of the original size. */
    record MultipleTargets(double tp1Ratio, double tp2Ratio, double tp1Fraction) implements TakeProfitSpec {
        public MultipleTargets {
            if (!(tp1Ratio > 0) || !(tp2Ratio > tp1Ratio)) {
                throw new IllegalArgumentException("targets must satisfy 0 < tp1 < tp2, got " + tp1Ratio + ", " + tp2Ratio);
            }
            if (!(tp1Fraction > 0) || !(tp1Fraction < 1)) {
                throw new IllegalArgumentException("tp1 fraction must be within (0, 1), got " + tp1Fraction);
            }
        }
    }

    /** No fixed target; once price reaches {@code activationRatio}, the stop trails by {@code trailPips}. */
    record Trailing(double activationRatio, double trailPips) implements TakeProfitSpec {
        public Trailing {
            if (!(activationRatio > 0) || !(trailPips > 0)) {
                throw new IllegalArgumentException("trailing activation and distance must be > 0");
            }
        }
    }
}
