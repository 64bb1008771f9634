package com.regimetrader.correlation;

import java.util.OptionalDouble;

/**
 * Pearson correlation of simple returns.
 */
final class PearsonCorrelation {

    private PearsonCorrelation() {}

    /** Simple returns of a price series; non-positive prices yield no return for that step. */
    static double[] returns(double[] prices) {
        if (prices.length < 2) {
            return new double[0];
        }
        double[] returns = new double[prices.length - 1];
        for (int i = 1; i < prices.length; i++) {
            returns[i - 1] = prices[i - 1] > 0 ? (prices[i] - prices[i - 1]) / prices[i - 1] : 0.0;
        }
        return returns;
    }

    /**
     * Correlation of the last {@code n} values of both series, where n is the shorter length.
     * Empty when either tail has zero variance or fewer than {@code minPoints} values.
     */
    static OptionalDouble correlate(double[] x, double[] y, int minPoints) {
        int n = Math.min(x.length, y.length);
        if (n < Math.max(2, minPoints)) {
            return OptionalDouble.empty();
        }
        int offsetX = x.length - n;
        int offsetY = y.length - n;
        double meanX = 0.0;
        double meanY = 0.0;
        for (int i = 0; i < n; i++) {
            meanX += x[offsetX + i];
            meanY += y[offsetY + i];
        }
        meanX /= n;
        meanY /= n;

        double covariance = 0.0;
        double varX = 0.0;
        double varY = 0.0;
        for (int i = 0; i < n; i++) {
            double dx = x[offsetX + i] - meanX;
            double dy = y[offsetY + i] - meanY;
            covariance += dx * dy;
            varX += dx * dx;
            varY += dy * dy;
        }
        if (varX <= 0 || varY <= 0) {
            return OptionalDouble.empty();
        }
        double r = covariance / Math.sqrt(varX * varY);
        return OptionalDouble.of(Math.max(-1.0, Math.min(1.0, r)));
    }
}
