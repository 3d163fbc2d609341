package com.rostrum.debate.model;

/**
 * Panel-level per-category scores for one side after trimming.
 */
public record CategoryAverages(
        double logic,
        double evidence,
        double rebuttal,
        double expression
) {
    public double get(ScoreCategory category) {
        return switch (category) {
            case LOGIC -> logic;
            case EVIDENCE -> evidence;
            case REBUTTAL -> rebuttal;
            case EXPRESSION -> expression;
        };
    }
}
