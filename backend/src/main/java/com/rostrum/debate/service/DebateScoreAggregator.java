package com.rostrum.debate.service;

import com.rostrum.debate.model.CategoryAverages;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.EliminatedScores;
import com.rostrum.debate.model.FinalScores;
import com.rostrum.debate.model.JudgeResult;
import com.rostrum.debate.model.ScoreCategory;
import com.rostrum.debate.model.SidePair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns the panel's verdicts into final scores: the single highest and single lowest value are dropped
 * and the rest averaged, independently per side, per category and for the composite total.
 */
@Component
public class DebateScoreAggregator {

    static final int MIN_TRIMMABLE = 3;

    public Verdict aggregate(List<JudgeResult> judgeResults) {
        if (judgeResults == null || judgeResults.size() < MIN_TRIMMABLE) {
            throw new IllegalArgumentException(
                    "At least " + MIN_TRIMMABLE + " judge results are required to aggregate scores");
        }

        List<Double> proTotals = new ArrayList<>(judgeResults.size());
        List<Double> conTotals = new ArrayList<>(judgeResults.size());
        for (JudgeResult result : judgeResults) {
            proTotals.add(result.totalScore().pro());
            conTotals.add(result.totalScore().con());
        }

        double proTotal = trimmedMean(proTotals);
        double conTotal = trimmedMean(conTotals);
        FinalScores finalScores = new FinalScores(
                SidePair.of(proTotal, conTotal),
                SidePair.of(
                        categoryAverages(judgeResults, DebateSide.PRO),
                        categoryAverages(judgeResults, DebateSide.CON)
                ),
                SidePair.of(eliminated(proTotals), eliminated(conTotals))
        );
        return new Verdict(finalScores, decideWinner(proTotal, conTotal));
    }

    /**
     * Mean of the values after removing one maximum and one minimum.
     */
    public static double trimmedMean(List<Double> values) {
        if (values == null || values.size() < MIN_TRIMMABLE) {
            throw new IllegalArgumentException(
                    "Trimmed mean needs at least " + MIN_TRIMMABLE + " values");
        }
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        double sum = 0.0;
        for (int i = 1; i < sorted.size() - 1; i++) {
            sum += sorted.get(i);
        }
        return sum / (sorted.size() - 2);
    }

    /**
     * Strictly greater trimmed total wins; equal totals are a tie, reported as {@code null}.
     */
    public static DebateSide decideWinner(double proTotal, double conTotal) {
        if (proTotal > conTotal) {
            return DebateSide.PRO;
        }
        if (conTotal > proTotal) {
            return DebateSide.CON;
        }
        return null;
    }

    static EliminatedScores eliminated(List<Double> values) {
        double highest = Double.NEGATIVE_INFINITY;
        double lowest = Double.POSITIVE_INFINITY;
        for (double value : values) {
            highest = Math.max(highest, value);
            lowest = Math.min(lowest, value);
        }
        return new EliminatedScores(highest, lowest);
    }

    private static CategoryAverages categoryAverages(List<JudgeResult> judgeResults, DebateSide side) {
        Map<ScoreCategory, Double> averages = new EnumMap<>(ScoreCategory.class);
        for (ScoreCategory category : ScoreCategory.values()) {
            List<Double> values = new ArrayList<>(judgeResults.size());
            for (JudgeResult result : judgeResults) {
                values.add((double) result.categoryScores().get(side).get(category));
            }
            averages.put(category, trimmedMean(values));
        }
        return new CategoryAverages(
                averages.get(ScoreCategory.LOGIC),
                averages.get(ScoreCategory.EVIDENCE),
                averages.get(ScoreCategory.REBUTTAL),
                averages.get(ScoreCategory.EXPRESSION)
        );
    }

    public record Verdict(
            FinalScores finalScores,
            DebateSide winner
    ) {
    }
}
