package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResult {

    private final List<TimeSeriesPoint> series;
    private final List<AnomalyAlert> anomalies;
    private final double volatilityPercent;
    private final TrendDirection trendDirection;
    private final double overallConfidence;

    // Absent when there were too few points to fit a trend
    private final RegressionStats regression;

    public ForecastResult(List<TimeSeriesPoint> series, List<AnomalyAlert> anomalies,
                          double volatilityPercent, TrendDirection trendDirection,
                          double overallConfidence, RegressionStats regression) {
        this.series = Collections.unmodifiableList(series);
        this.anomalies = Collections.unmodifiableList(anomalies);
        this.volatilityPercent = volatilityPercent;
        this.trendDirection = trendDirection;
        this.overallConfidence = overallConfidence;
        this.regression = regression;
    }

    /**
     * Neutral result for series too short to model.
     */
    public static ForecastResult degraded(List<TimeSeriesPoint> series) {
        return new ForecastResult(series, Collections.emptyList(), 0.0, TrendDirection.STABLE, 0.0, null);
    }

    public long countHighSeverityAnomalies() {
        return anomalies.stream().filter(AnomalyAlert::isHighSeverity).count();
    }
}
