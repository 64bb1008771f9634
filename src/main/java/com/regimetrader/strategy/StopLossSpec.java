package com.regimetrader.strategy;

/**
 * How a strategy places its stop-loss.
 */
public sealed interface StopLossSpec {

    /** Constant distance in pips. */
    record FixedPips(double pips) implements StopLossSpec {
        public FixedPips {
            requirePositive(pips, "pips");
        }
    }

    /** Distance of {@code multiplier} times the current ATR. */
    record AtrMultiple(double multiplier) implements StopLossSpec {
        public AtrMultiple {
            requirePositive(multiplier, "atr multiplier");
        }
    }

    /** Beyond the signal's structure level by {@code bufferPips}. */
    record StructureBuffer(double bufferPips) implements StopLossSpec {
        public StructureBuffer {
            if (!(bufferPips >= 0)) {
                throw new IllegalArgumentException("buffer pips must be >= 0, got " + bufferPips);
            }
        }
    }

    private static void requirePositive(double value, String name) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive number, got " + value);
        }
    }
}
