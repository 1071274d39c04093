package com.bmsedge.forecast.engine;

import com.bmsedge.forecast.model.AnomalyAlert;
import com.bmsedge.forecast.model.AnomalyKind;
import com.bmsedge.forecast.model.AnomalySeverity;
import com.bmsedge.forecast.model.TimeSeriesPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.text.NumberFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Flags interior points that stand out against both of their neighbours and against the
 * series as a whole. A point must beat its neighbours by the ratio threshold AND lie more than
 * one standard deviation from the mean to be reported.
 */
@Component
public class AnomalyDetector {

    private static final Logger logger = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final double DEFAULT_THRESHOLD = 1.5;

    private static final int MIN_POINTS = 3;

    public List<AnomalyAlert> detect(List<TimeSeriesPoint> series) {
        return detect(series, DEFAULT_THRESHOLD);
    }

    /**
     * Scan a series for peaks and troughs.
     *
     * @param series    points in the order they should be compared
     * @param threshold neighbour ratio a point must exceed, finite and positive
     * @return alerts in series order, empty when there are fewer than three points
     */
    public List<AnomalyAlert> detect(List<TimeSeriesPoint> series, double threshold) {
        if (!(threshold > 0) || Double.isInfinite(threshold)) {
            throw new IllegalArgumentException("Threshold must be a positive finite number: " + threshold);
        }
        if (series == null || series.size() < MIN_POINTS) {
            return Collections.emptyList();
        }

        double[] values = new double[series.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = series.get(i).effectiveValue();
        }

        double mean = VolatilityEstimator.mean(values);
        double stdDev = VolatilityEstimator.standardDeviation(values, mean);

        List<AnomalyAlert> alerts = new ArrayList<>();

        for (int i = 1; i < values.length - 1; i++) {
            double current = values[i];
            double previous = values[i - 1];
            double next = values[i + 1];

            if (current > previous * threshold && current > next * threshold && current > mean + stdDev) {
                AnomalySeverity severity = current > mean + 2 * stdDev ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM;
                String message = String.format(Locale.US, "Peak detected: %s (%.1f%% above average)",
                        formatValue(current), deviationPercent(current / mean - 1, mean));
                alerts.add(new AnomalyAlert(series.get(i).getDate(), current, AnomalyKind.PEAK, severity, message));
            } else if (current < previous / threshold && current < next / threshold && current < mean - stdDev) {
                AnomalySeverity severity = current < mean - 2 * stdDev ? AnomalySeverity.HIGH : AnomalySeverity.MEDIUM;
                String message = String.format(Locale.US, "Trough detected: %s (%.1f%% below average)",
                        formatValue(current), deviationPercent(1 - current / mean, mean));
                alerts.add(new AnomalyAlert(series.get(i).getDate(), current, AnomalyKind.TROUGH, severity, message));
            }
        }

        logger.debug("Anomaly scan over {} points (threshold {}): mean={}, stdDev={}, alerts={}",
                values.length, threshold, mean, stdDev, alerts.size());

        return alerts;
    }

    private static double deviationPercent(double ratio, double mean) {
        return mean == 0 ? 0 : ratio * 100;
    }

    private static String formatValue(double value) {
        NumberFormat format = NumberFormat.getNumberInstance(Locale.US);
        format.setMaximumFractionDigits(3);
        return format.format(value);
    }
}
