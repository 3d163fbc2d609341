package com.rostrum.debate.model;

public record HighlightedScore(
        DebateSide side,
        ScoreCategory category,
        double score
) {
}
