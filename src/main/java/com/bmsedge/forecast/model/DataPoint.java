package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Getter;

import java.time.LocalDate;

/**
 * Canonical input observation: one value for one calendar day.
 */
@Getter
public class DataPoint {

    /**
     * Largest accepted magnitude. Squared deviations of values beyond this overflow a double.
     */
    public static final double MAX_ABS_VALUE = 1e150;

    @JsonFormat(pattern = "yyyy-MM-dd")
    private final LocalDate date;

    private final double value;

    public DataPoint(LocalDate date, double value) {
        this.date = date;
        this.value = value;
    }

    public static DataPoint of(String isoDate, double value) {
        return new DataPoint(LocalDate.parse(isoDate), value);
    }

    @Override
    public String toString() {
        return "DataPoint{" + date + "=" + value + "}";
    }
}
