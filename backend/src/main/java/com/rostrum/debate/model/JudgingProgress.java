package com.rostrum.debate.model;

/**
 * Where the judging phase currently stands, for live status views.
 */
public record JudgingProgress(
        ScoringPhase phase,
        int currentJudge,
        int totalJudges,
        double revealProgress,
        HighlightedScore highlightedScore,
        EliminatedScores eliminatedScores
) {
}
