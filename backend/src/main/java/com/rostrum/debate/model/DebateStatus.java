package com.rostrum.debate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DebateStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    JUDGING("judging"),
    COMPLETED("completed"),
    ERROR("error");

    private final String wireValue;

    DebateStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public boolean terminal() {
        return this == COMPLETED || this == ERROR;
    }

    @JsonCreator
    public static DebateStatus fromWireValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DebateStatus status : values()) {
                if (status.wireValue.equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Unknown debate status: " + value);
    }
}
