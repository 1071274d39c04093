package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TrendDirection {
    INCREASING,
    DECREASING,
    STABLE;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
