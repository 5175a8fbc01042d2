package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Sensitivity category of the data a project collects. Together with the compliance region it
 * selects the regulatory minimum retention period.
 */
public enum DataClassification {
    GENERAL("general"),
    FINANCIAL("financial"),
    GOVERNMENT("government"),
    HEALTHCARE("healthcare"),
    PII("pii"),
    SENSITIVE("sensitive");

    private final String wireValue;

    DataClassification(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static DataClassification fromString(String v) {
        for (DataClassification c : values()) {
            if (c.wireValue.equals(v) || c.name().equals(v)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown DataClassification: " + v);
    }
}
