package com.rostrum.debate.model;

/**
 * Trimmed-mean aggregate of the panel. Totals and category averages are trimmed independently.
 */
public record FinalScores(
        SidePair<Double> total,
        SidePair<CategoryAverages> categories,
        SidePair<EliminatedScores> eliminated
) {
}
