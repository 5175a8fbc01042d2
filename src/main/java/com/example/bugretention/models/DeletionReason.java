package com.example.bugretention.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DeletionReason {
    RETENTION_POLICY("retention_policy"),
    MANUAL("manual"),
    GDPR_REQUEST("gdpr_request"),
    CCPA_REQUEST("ccpa_request"),
    USER_REQUEST("user_request"),
    LEGAL_HOLD_RELEASED("legal_hold_released");

    private final String wireValue;

    DeletionReason(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static DeletionReason fromString(String v) {
        for (DeletionReason r : values()) {
            if (r.wireValue.equals(v) || r.name().equals(v)) {
                return r;
            }
        }
        throw new IllegalArgumentException("Unknown DeletionReason: " + v);
    }
}
