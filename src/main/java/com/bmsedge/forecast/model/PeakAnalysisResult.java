package com.bmsedge.forecast.model;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

@Getter
public class PeakAnalysisResult {

    private final List<AnomalyAlert> anomalies;
    private final double volatilityPercent;
    private final long peakCount;
    private final long troughCount;
    private final long highSeverityCount;

    public PeakAnalysisResult(List<AnomalyAlert> anomalies, double volatilityPercent) {
        this.anomalies = Collections.unmodifiableList(anomalies);
        this.volatilityPercent = volatilityPercent;
        this.peakCount = anomalies.stream().filter(a -> a.getKind() == AnomalyKind.PEAK).count();
        this.troughCount = anomalies.stream().filter(a -> a.getKind() == AnomalyKind.TROUGH).count();
        this.highSeverityCount = anomalies.stream().filter(AnomalyAlert::isHighSeverity).count();
    }
}
