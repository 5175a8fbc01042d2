package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Subscription level of a project. Bounds the retention range a non-admin caller may configure.
 */
public enum ProjectTier {
    FREE("free"),
    PROFESSIONAL("professional"),
    ENTERPRISE("enterprise");

    private final String wireValue;

    ProjectTier(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static ProjectTier fromString(String v) {
        for (ProjectTier t : values()) {
            if (t.wireValue.equals(v) || t.name().equals(v)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown ProjectTier: " + v);
    }
}
