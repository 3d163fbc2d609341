package com.rostrum.debate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Judging criteria with their fixed weight in a judge's composite score.
 */
public enum ScoreCategory {
    LOGIC("logic", 0.3),
    EVIDENCE("evidence", 0.3),
    REBUTTAL("rebuttal", 0.2),
    EXPRESSION("expression", 0.2);

    private final String wireValue;
    private final double weight;

    ScoreCategory(String wireValue, double weight) {
        this.wireValue = wireValue;
        this.weight = weight;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public double weight() {
        return weight;
    }

    @JsonCreator
    public static ScoreCategory fromWireValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ScoreCategory category : values()) {
                if (category.wireValue.equals(normalized)) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Unknown score category: " + value);
    }
}
