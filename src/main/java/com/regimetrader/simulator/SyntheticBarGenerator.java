package com.regimetrader.simulator;

import com.regimetrader.domain.enums.InstrumentClass;
import com.regimetrader.domain.model.Bar;
import java.time.Instant;
import java.util.Locale;
import java.util.Random;

/**
 * Geometric random walk with a pull back towards the start price, shaped per instrument class:
 * crash/boom indices add rare one-sided spikes, step indices move in fixed increments and jump
 * indices add occasional large moves in either direction.
 */
class SyntheticBarGenerator {

    private static final double MEAN_REVERSION = 0.02;
    private static final double SPIKE_PROBABILITY = 1.0 / 300;
    private static final double SPIKE_MAGNITUDE = 0.05;
    private static final double STEP_SIZE = 0.002;
    private static final double JUMP_PROBABILITY = 1.0 / 50;
    private static final double JUMP_MIN = 0.002;
    private static final double JUMP_MAX = 0.010;

    private final InstrumentClass instrumentClass;
    private final double anchor;
    private final double volatility;
    private final double spread;
    private final boolean crash;
    private final Random random;

    private double lastClose;

    SyntheticBarGenerator(
            InstrumentClass instrumentClass,
            String symbol,
            double startPrice,
            double volatility,
            double spread,
            Random random) {
        this.instrumentClass = instrumentClass;
        this.anchor = startPrice;
        this.volatility = volatility;
        this.spread = spread;
        this.crash = symbol.toUpperCase(Locale.ROOT).contains("CRASH");
        this.random = random;
        this.lastClose = startPrice;
    }

    Bar next(Instant openTime) {
        double open = lastClose;
        double logReturn = MEAN_REVERSION * Math.log(anchor / open) + random.nextGaussian() * volatility;

        switch (instrumentClass) {
            case SYNTHETIC_CRASH_BOOM -> {
                if (random.nextDouble() < SPIKE_PROBABILITY) {
                    logReturn += crash ? -SPIKE_MAGNITUDE : SPIKE_MAGNITUDE;
                }
            }
            case SYNTHETIC_STEP -> logReturn = random.nextBoolean() ? STEP_SIZE : -STEP_SIZE;
            case SYNTHETIC_JUMP -> {
                if (random.nextDouble() < JUMP_PROBABILITY) {
                    double jump = JUMP_MIN + random.nextDouble() * (JUMP_MAX - JUMP_MIN);
                    logReturn += random.nextBoolean() ? jump : -jump;
                }
            }
            default -> {
                // plain random walk
            }
        }

        double close = open * Math.exp(logReturn);
        double wick = Math.abs(random.nextGaussian()) * volatility * 0.5;
        double high = Math.max(open, close) * (1 + wick);
        double low = Math.min(open, close) * (1 - wick);
        lastClose = close;

        return Bar.builder()
                .openTime(openTime)
                .open(open)
                .high(high)
                .low(low)
                .close(close)
                .volume(100 + random.nextInt(900))
                .spread(spread)
                .build();
    }

    double lastClose() {
        return lastClose;
    }
}
