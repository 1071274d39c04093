package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Forecast over a synthetic seasonal history, with the month profile and the
 * recommendations derived from it. The forecast fields are flattened into the same
 * JSON object.
 */
@Getter
public class SeasonalTrendsResult {

    @JsonUnwrapped
    private final ForecastResult forecast;

    private final SeasonalAnalysis seasonalAnalysis;

    private final List<Recommendation> recommendations;

    public SeasonalTrendsResult(ForecastResult forecast, SeasonalAnalysis seasonalAnalysis,
                                List<Recommendation> recommendations) {
        this.forecast = forecast;
        this.seasonalAnalysis = seasonalAnalysis;
        this.recommendations = Collections.unmodifiableList(recommendations);
    }
}
