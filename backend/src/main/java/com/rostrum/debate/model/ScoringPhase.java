package com.rostrum.debate.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScoringPhase {
    NOT_STARTED("not_started"),
    JUDGE_THINKING("judge_thinking"),
    REVEALING_SCORES("revealing_scores"),
    CALCULATING_FINAL("calculating_final"),
    SHOWING_WINNER("showing_winner"),
    COMPLETED("completed");

    private final String wireValue;

    ScoringPhase(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }
}
