package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AnomalyKind {
    PEAK,
    TROUGH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
