package com.rostrum.debate.service;

import com.rostrum.debate.model.CategoryRationales;
import com.rostrum.debate.model.CategoryScores;
import com.rostrum.debate.model.RecommendedWinner;
import com.rostrum.debate.model.SidePair;

import java.util.List;

/**
 * Everything that could be read out of one judge's free-text evaluation.
 *
 * @param confidence share of the eight category scores actually found in the text, in [0,1]
 */
public record ScoreExtraction(
        SidePair<CategoryScores> scores,
        SidePair<CategoryRationales> rationales,
        List<String> strengths,
        List<String> weaknesses,
        List<String> suggestions,
        String overallComment,
        RecommendedWinner recommendedWinner,
        double confidence
) {
    public ScoreExtraction {
        strengths = strengths == null ? List.of() : List.copyOf(strengths);
        weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }
}
