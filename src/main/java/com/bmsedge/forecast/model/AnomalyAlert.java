package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Getter;

import java.time.LocalDate;

@Getter
public class AnomalyAlert {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate date;

    private final double value;

    private final AnomalyKind kind;

    private final AnomalySeverity severity;

    private final String message;

    public AnomalyAlert(LocalDate date, double value, AnomalyKind kind,
                        AnomalySeverity severity, String message) {
        this.date = date;
        this.value = value;
        this.kind = kind;
        this.severity = severity;
        this.message = message;
    }

    @JsonIgnore
    public boolean isHighSeverity() {
        return severity == AnomalySeverity.HIGH;
    }
}
