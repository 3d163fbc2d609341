package com.rostrum.debate.model;

/**
 * One judge's 0-100 scores for one side.
 */
public record CategoryScores(
        int logic,
        int evidence,
        int rebuttal,
        int expression
) {
    public int get(ScoreCategory category) {
        return switch (category) {
            case LOGIC -> logic;
            case EVIDENCE -> evidence;
            case REBUTTAL -> rebuttal;
            case EXPRESSION -> expression;
        };
    }

    /**
     * Weighted composite: 0.3 logic, 0.3 evidence, 0.2 rebuttal, 0.2 expression.
     */
    public double composite() {
        double total = 0.0;
        for (ScoreCategory category : ScoreCategory.values()) {
            total += get(category) * category.weight();
        }
        return total;
    }

    public static CategoryScores uniform(int score) {
        return new CategoryScores(score, score, score, score);
    }
}
