package com.bmsedge.forecast.engine;

import lombok.Getter;

/**
 * Ordinary least squares line fitted to (x, y) pairs.
 */
@Getter
public final class TrendModel {

    private final double slope;
    private final double intercept;

    private TrendModel(double slope, double intercept) {
        this.slope = slope;
        this.intercept = intercept;
    }

    /**
     * Fit a line through the given points using the closed-form OLS estimators.
     *
     * @param x independent values, at least two and not all equal
     * @param y observed values, same length as {@code x}
     */
    public static TrendModel fit(double[] x, double[] y) {
        if (x.length != y.length) {
            throw new IllegalArgumentException("x and y must have the same length: " + x.length + " vs " + y.length);
        }
        int n = x.length;
        if (n < 2) {
            throw new IllegalArgumentException("At least two points are required to fit a trend, got " + n);
        }

        // y is fitted at unit scale and the coefficients scaled back, keeping the sums finite
        double scale = 0;
        for (double value : y) {
            scale = Math.max(scale, Math.abs(value));
        }
        if (scale == 0) scale = 1;

        double sumX = 0;
        double sumY = 0;
        double sumXY = 0;
        double sumX2 = 0;

        for (int i = 0; i < n; i++) {
            double scaledY = y[i] / scale;
            sumX += x[i];
            sumY += scaledY;
            sumXY += x[i] * scaledY;
            sumX2 += x[i] * x[i];
        }

        double denominator = n * sumX2 - sumX * sumX;
        if (denominator == 0) {
            throw new IllegalArgumentException("x values must not all be equal");
        }

        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        return new TrendModel(slope * scale, intercept * scale);
    }

    /**
     * Fit against the sequential index {@code 0..n-1}.
     */
    public static TrendModel fitSequential(double[] y) {
        double[] x = new double[y.length];
        for (int i = 0; i < x.length; i++) {
            x[i] = i;
        }
        return fit(x, y);
    }

    public double predict(double x) {
        return slope * x + intercept;
    }
}
