package com.rostrum.debate.model;

public record CategoryRationales(
        String logic,
        String evidence,
        String rebuttal,
        String expression
) {
    public String get(ScoreCategory category) {
        return switch (category) {
            case LOGIC -> logic;
            case EVIDENCE -> evidence;
            case REBUTTAL -> rebuttal;
            case EXPRESSION -> expression;
        };
    }

    public static CategoryRationales uniform(String rationale) {
        return new CategoryRationales(rationale, rationale, rationale, rationale);
    }
}
