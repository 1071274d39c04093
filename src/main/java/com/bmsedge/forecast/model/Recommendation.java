package com.bmsedge.forecast.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

@Getter
public class Recommendation {

    public enum Type {
        OPPORTUNITY,
        WARNING;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }

    public enum Priority {
        HIGH,
        MEDIUM;

        @JsonValue
        public String toJson() {
            return name().toLowerCase();
        }
    }

    private final Type type;
    private final String title;
    private final String description;
    private final Priority priority;

    public Recommendation(Type type, String title, String description, Priority priority) {
        this.type = type;
        this.title = title;
        this.description = description;
        this.priority = priority;
    }
}
