package com.regimetrader.strategy.signal;

import org.ta4j.core.BarSeries;
import org.ta4j.core.indicators.ATRIndicator;

/**
 * Bar-level helpers shared by the signal generators. Index ranges are inclusive.
 */
final class SeriesMath {

    private SeriesMath() {}

    static double open(BarSeries series, int index) {
        return series.getBar(index).getOpenPrice().doubleValue();
    }

    static double high(BarSeries series, int index) {
        return series.getBar(index).getHighPrice().doubleValue();
    }

    static double low(BarSeries series, int index) {
        return series.getBar(index).getLowPrice().doubleValue();
    }

    static double close(BarSeries series, int index) {
        return series.getBar(index).getClosePrice().doubleValue();
    }

    static double highestHigh(BarSeries series, int from, int to) {
        double highest = Double.NEGATIVE_INFINITY;
        for (int i = Math.max(from, series.getBeginIndex()); i <= to; i++) {
            highest = Math.max(highest, high(series, i));
        }
        return highest;
    }

    static double lowestLow(BarSeries series, int from, int to) {
        double lowest = Double.POSITIVE_INFINITY;
        for (int i = Math.max(from, series.getBeginIndex()); i <= to; i++) {
            lowest = Math.min(lowest, low(series, i));
        }
        return lowest;
    }

    static double atr(BarSeries series, int period) {
        double value = new ATRIndicator(series, period).getValue(series.getEndIndex()).doubleValue();
        return Double.isFinite(value) ? value : 0.0;
    }
}
