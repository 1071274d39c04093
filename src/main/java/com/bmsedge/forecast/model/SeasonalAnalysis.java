package com.bmsedge.forecast.model;

import lombok.Getter;

/**
 * Month-of-year profile of a historical series. Month indexes are zero-based (0 = January).
 */
@Getter
public class SeasonalAnalysis {

    private final double[] monthlyAverages;
    private final double overallAverage;
    private final double[] seasonalFactors;
    private final int peakMonth;
    private final int lowMonth;

    public SeasonalAnalysis(double[] monthlyAverages, double overallAverage,
                            double[] seasonalFactors, int peakMonth, int lowMonth) {
        this.monthlyAverages = monthlyAverages.clone();
        this.overallAverage = overallAverage;
        this.seasonalFactors = seasonalFactors.clone();
        this.peakMonth = peakMonth;
        this.lowMonth = lowMonth;
    }

    public double[] getMonthlyAverages() {
        return monthlyAverages.clone();
    }

    public double[] getSeasonalFactors() {
        return seasonalFactors.clone();
    }
}
