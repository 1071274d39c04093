package com.bmsedge.forecast.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

/**
 * Body of a custom forecast request. {@code data} is kept as raw JSON so record shape is
 * checked by the series adapter rather than failing inside the message converter.
 */
@Setter
@Getter
public class ForecastRequest {

    @NotNull(message = "Data is required")
    private JsonNode data;

    @Min(value = 0, message = "Forecast period must be non-negative")
    private Integer forecastPeriod;

    public ForecastRequest() {}

    public ForecastRequest(JsonNode data, Integer forecastPeriod) {
        this.data = data;
        this.forecastPeriod = forecastPeriod;
    }
}
