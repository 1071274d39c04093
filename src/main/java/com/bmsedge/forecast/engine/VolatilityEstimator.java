package com.bmsedge.forecast.engine;

/**
 * Coefficient of variation of a series, expressed as a percentage.
 */
public final class VolatilityEstimator {

    private VolatilityEstimator() {
    }

    public static double volatilityPercent(double[] values) {
        if (values.length < 2) return 0;

        double mean = mean(values);
        if (mean == 0) return 0;

        double percent = standardDeviation(values, mean) / mean * 100;
        return Math.max(0, percent);
    }

    static double mean(double[] values) {
        if (values.length == 0) return 0;

        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation around the supplied mean.
     */
    static double standardDeviation(double[] values, double mean) {
        if (values.length == 0) return 0;

        double scale = 0;
        for (double value : values) {
            scale = Math.max(scale, Math.abs(value - mean));
        }
        if (scale == 0) return 0;

        double sumSquares = 0;
        for (double value : values) {
            double deviation = (value - mean) / scale;
            sumSquares += deviation * deviation;
        }
        return scale * Math.sqrt(sumSquares / values.length);
    }
}
