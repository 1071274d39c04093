package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalySeverity {
    MEDIUM,
    HIGH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
