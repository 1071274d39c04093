package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;

@Getter
public class RegressionStats {
    private final double slope;
    private final double intercept;
    private final double rSquared;

    public RegressionStats(double slope, double intercept, double rSquared) {
        this.slope = slope;
        this.intercept = intercept;
        this.rSquared = rSquared;
    }

    // Lombok would derive "rsquared" as the JSON name
    @JsonProperty("rSquared")
    public double getRSquared() {
        return rSquared;
    }
}
