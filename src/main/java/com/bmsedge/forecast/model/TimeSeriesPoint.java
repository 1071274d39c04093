package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

import java.time.LocalDate;

/**
 * One point of a forecast series. Historical points carry the observed value in
 * {@code actual}; forecast points leave it null.
 */
@Getter
public class TimeSeriesPoint {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate date;

    private final Double actual;

    private final double predicted;

    private final double seasonal;

    // Raw regression value, not clamped at zero
    private final double trend;

    private final double confidence;

    @JsonProperty("isForecast")
    private final boolean forecast;

    public TimeSeriesPoint(LocalDate date, Double actual, double predicted, double seasonal,
                           double trend, double confidence, boolean forecast) {
        this.date = date;
        this.actual = actual;
        this.predicted = predicted;
        this.seasonal = seasonal;
        this.trend = trend;
        this.confidence = confidence;
        this.forecast = forecast;
    }

    /**
     * Wraps an observation without any model annotation. Used where no trend can be fitted
     * and for externally supplied series handed to anomaly analysis.
     */
    public static TimeSeriesPoint observed(DataPoint point) {
        double value = point.getValue();
        return new TimeSeriesPoint(point.getDate(), value, value, value, value, 1.0, false);
    }

    /**
     * Value the anomaly scan looks at: the observation when there is one, else the prediction.
     */
    public double effectiveValue() {
        return actual != null ? actual : predicted;
    }
}
