package com.rostrum.debate.model;

import java.util.List;

/**
 * Verdict of a single judge, produced once and never changed.
 *
 * <p>{@code degraded} marks the neutral fallback verdict returned when the judge could not be reached
 * or its answer could not be read; such a verdict still carries every score so aggregation never has to
 * special-case it.
 */
public record JudgeResult(
        String judgeName,
        SidePair<Double> totalScore,
        SidePair<CategoryScores> categoryScores,
        SidePair<CategoryRationales> rationales,
        String overallComment,
        List<String> strengths,
        List<String> weaknesses,
        List<String> suggestions,
        RecommendedWinner recommendedWinner,
        String rawText,
        double confidence,
        boolean degraded
) {
    public JudgeResult {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
