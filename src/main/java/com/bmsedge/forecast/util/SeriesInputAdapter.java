package com.bmsedge.forecast.util;

import com.bmsedge.forecast.exception.InvalidInputException;
import com.bmsedge.forecast.model.DataPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts loosely shaped {@code {date, value}} records into {@link DataPoint}s.
 *
 * Older callers send the number under {@code actual}, newer ones under {@code value}.
 * {@code actual} wins when both are present; a record with neither counts as 0.
 */
public class SeriesInputAdapter {

    public static final String DATE_FIELD = "date";
    public static final String VALUE_FIELD = "value";
    public static final String LEGACY_VALUE_FIELD = "actual";

    private SeriesInputAdapter() {
    }

    /**
     * Parse a JSON array given as text, e.g. from a query parameter.
     */
    public static List<DataPoint> fromJson(String json, ObjectMapper objectMapper) {
        if (json == null || json.trim().isEmpty()) {
            throw new InvalidInputException("Data parameter required");
        }
        try {
            return fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("Data must be valid JSON", e);
        }
    }

    public static List<DataPoint> fromJson(JsonNode data) {
        if (data == null || data.isNull() || data.isMissingNode() || !data.isArray()) {
            throw new InvalidInputException("Data must be an array of objects with date and value properties");
        }

        List<DataPoint> points = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            JsonNode record = data.get(i);
            if (record == null || !record.isObject()) {
                throw new InvalidInputException("Record " + i + " must be an object with date and value properties");
            }
            points.add(new DataPoint(parseDate(record.get(DATE_FIELD), i), parseValue(record, i)));
        }
        return points;
    }

    private static LocalDate parseDate(JsonNode node, int index) {
        if (node == null || node.isNull() || !node.isTextual() || node.asText().trim().isEmpty()) {
            throw new InvalidInputException("Record " + index + " is missing a date");
        }

        String text = node.asText().trim();
        try {
            if (text.indexOf('T') > 0) {
                return LocalDate.from(DateTimeFormatter.ISO_DATE_TIME.parse(text));
            }
            return LocalDate.parse(text);
        } catch (DateTimeException e) {
            throw new InvalidInputException("Record " + index + " has an invalid date '" + text
                    + "'. Please use YYYY-MM-DD format", e);
        }
    }

    private static double parseValue(JsonNode record, int index) {
        JsonNode node = record.get(LEGACY_VALUE_FIELD);
        String field = LEGACY_VALUE_FIELD;
        if (node == null || node.isNull()) {
            node = record.get(VALUE_FIELD);
            field = VALUE_FIELD;
        }
        // TODO: reject records with neither field once all callers send "value"
        if (node == null || node.isNull()) {
            return 0;
        }

        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            String text = node.asText().trim();
            try {
                value = Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Record " + index + " has a non-numeric " + field + " '" + text + "'", e);
            }
        } else {
            throw new InvalidInputException("Record " + index + " has a non-numeric " + field);
        }

        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new InvalidInputException("Record " + index + " has a non-finite " + field);
        }
        if (Math.abs(value) > DataPoint.MAX_ABS_VALUE) {
            throw new InvalidInputException("Record " + index + " has a " + field + " outside the supported range");
        }
        return value;
    }
}
