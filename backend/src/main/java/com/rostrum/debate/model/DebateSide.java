package com.rostrum.debate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DebateSide {
    PRO("pro"),
    CON("con");

    private final String wireValue;

    DebateSide(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public DebateSide opponent() {
        return this == PRO ? CON : PRO;
    }

    /**
     * Side that speaks at the given transcript index; pro always opens a round.
     */
    public static DebateSide forTurnIndex(int index) {
        return index % 2 == 0 ? PRO : CON;
    }

    @JsonCreator
    public static DebateSide fromWireValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (DebateSide side : values()) {
                if (side.wireValue.equals(normalized)) {
                    return side;
                }
            }
        }
        throw new IllegalArgumentException("Unknown debate side: " + value);
    }
}
