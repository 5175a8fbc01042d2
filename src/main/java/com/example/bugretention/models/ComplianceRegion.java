package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Regulatory jurisdiction applied to a project.
 */
public enum ComplianceRegion {
    NONE("none"),
    EU("eu"),
    US("us"),
    KZ("kz"),
    UK("uk"),
    CA("ca");

    private final String wireValue;

    ComplianceRegion(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ComplianceRegion fromString(String v) {
        for (ComplianceRegion r : values()) {
            if (r.wireValue.equalsIgnoreCase(v) || r.name().equals(v)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown ComplianceRegion: " + v);
    }
}
