package com.bmsedge.forecast.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
public class SeasonalAnalysisPreview {

    private final SeasonalAnalysis seasonalAnalysis;
    private final List<DataPoint> historicalData;
    private final Summary summary;

    public SeasonalAnalysisPreview(SeasonalAnalysis seasonalAnalysis, List<DataPoint> historicalData,
                                   Summary summary) {
        this.seasonalAnalysis = seasonalAnalysis;
        this.historicalData = Collections.unmodifiableList(historicalData);
        this.summary = summary;
    }

    // Human-readable digest of the month profile
    @Getter
    public static class Summary {
        private final String peakMonth;
        private final String lowMonth;
        private final long overallAverage;
        private final String seasonalVariation;

        public Summary(String peakMonth, String lowMonth, long overallAverage, String seasonalVariation) {
            this.peakMonth = peakMonth;
            this.lowMonth = lowMonth;
            this.overallAverage = overallAverage;
            this.seasonalVariation = seasonalVariation;
        }
    }
}
