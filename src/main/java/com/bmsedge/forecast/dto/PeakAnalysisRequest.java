package com.bmsedge.forecast.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Setter
@Getter
public class PeakAnalysisRequest {

    @NotNull(message = "Data is required")
    private JsonNode data;

    @DecimalMin(value = "0.0", inclusive = false, message = "Threshold must be positive")
    private Double threshold;

    public PeakAnalysisRequest() {}

    public PeakAnalysisRequest(JsonNode data, Double threshold) {
        this.data = data;
        this.threshold = threshold;
    }
}
