package com.rostrum.debate.service;

import com.rostrum.debate.DebateTestFixtures;
import com.rostrum.debate.model.CategoryScores;
import com.rostrum.debate.model.DebateSide;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class JudgeResponseParserTest {

    @Test
    void readsStructuredEvaluation() {
        String text = DebateTestFixtures.judgeText(
                new CategoryScores(82, 78, 74, 80),
                new CategoryScores(76, 70, 81, 72),
                "pro"
        );

        ScoreExtraction extraction = JudgeResponseParser.extract(text);

        assertEquals(new CategoryScores(82, 78, 74, 80), extraction.scores().pro());
        assertEquals(new CategoryScores(76, 70, 81, 72), extraction.scores().con());
        assertEquals(1.0, extraction.confidence());
        assertEquals("Tight reasoning.", extraction.rationales().pro().logic());
        assertEquals("Too few sources.", extraction.rationales().con().evidence());
        assertEquals(JudgeResponseParser.DEFAULT_RATIONALE, extraction.rationales().con().logic());
        assertEquals(List.of("direct clash", "clear framing"), extraction.strengths());
        assertEquals(List.of("repetition"), extraction.weaknesses());
        assertEquals(List.of("quantify the claims"), extraction.suggestions());
        assertEquals("Competitive exchange.", extraction.overallComment());
        assertEquals(DebateSide.PRO, extraction.recommendedWinner().side());
        assertEquals("better weighing", extraction.recommendedWinner().reason());
    }

    @Test
    void acceptsSynonymsAndSidePrefixedScores() {
        String text = """
                Affirmative scores
                Reasoning: 90
                Support - 85
                Refutation: 80/100
                Delivery: 70

                Negative side scores:
                Argument: 60
                Evidence: 65
                Response: 55
                Persuasiveness: 50
                """;

        ScoreExtraction extraction = JudgeResponseParser.extract(text);

        assertEquals(new CategoryScores(90, 85, 80, 70), extraction.scores().pro());
        assertEquals(new CategoryScores(60, 65, 55, 50), extraction.scores().con());
        assertEquals(1.0, extraction.confidence());
    }

    @Test
    void firstMatchWinsForRepeatedCategory() {
        String text = """
                PRO SCORES
                Logic: 88
                Logic: 12
                Evidence: 70
                """;

        ScoreExtraction extraction = JudgeResponseParser.extract(text);

        assertEquals(88, extraction.scores().pro().logic());
    }

    @Test
    void outOfRangeValuesFallBackToDefault() {
        String text = """
                PRO SCORES
                Logic: 150
                Evidence: 70
                Rebuttal: 72
                Expression: 74
                """;

        ScoreExtraction extraction = JudgeResponseParser.extract(text);

        assertEquals(new CategoryScores(75, 70, 72, 74), extraction.scores().pro());
        assertEquals(CategoryScores.uniform(75), extraction.scores().con());
        assertEquals(3.0 / 8.0, extraction.confidence());
    }

    @Test
    void fewerThanTwoScoresFallsBackToDefaultsEverywhere() {
        String text = """
                PRO SCORES
                Logic: 95
                The rest of my notes were lost.
                """;

        ScoreExtraction extraction = JudgeResponseParser.extract(text);

        assertEquals(CategoryScores.uniform(75), extraction.scores().pro());
        assertEquals(CategoryScores.uniform(75), extraction.scores().con());
        assertEquals(1.0 / 8.0, extraction.confidence());
    }

    @Test
    void unstructuredTextNeverFails() {
        String text = "I enjoyed this debate a great deal but will not give numbers.";

        ScoreExtraction extraction = assertDoesNotThrow(() -> JudgeResponseParser.extract(text));

        assertEquals(CategoryScores.uniform(75), extraction.scores().pro());
        assertEquals(0.0, extraction.confidence());
        assertEquals(text, extraction.overallComment());
        assertEquals(List.of(JudgeResponseParser.DEFAULT_STRENGTH), extraction.strengths());
        assertEquals(List.of(JudgeResponseParser.DEFAULT_WEAKNESS), extraction.weaknesses());
        assertEquals(List.of(JudgeResponseParser.DEFAULT_SUGGESTION), extraction.suggestions());
        assertNull(extraction.recommendedWinner());
    }

    @Test
    void nullTextYieldsDefaults() {
        ScoreExtraction extraction = JudgeResponseParser.extract(null);

        assertEquals(CategoryScores.uniform(75), extraction.scores().con());
        assertEquals("", extraction.overallComment());
    }

    @Test
    void highlightsSplitOnPunctuationAndDropOverlongItems() {
        String overlong = "x".repeat(120);
        List<String> items = JudgeResponseParser.highlights(
                "- crisp framing; strong data. " + overlong + "\n2) good pacing，清晰",
                "fallback"
        );

        assertEquals(List.of("crisp framing", "strong data", "good pacing", "清晰"), items);
    }

    @Test
    void multiLineHighlightSectionIsCollected() {
        String text = """
                STRENGTHS:
                - strong opening
                - well sourced
                WEAKNESSES: none worth noting
                """;

        ScoreExtraction extraction = JudgeResponseParser.extract(text);

        assertEquals(List.of("strong opening", "well sourced"), extraction.strengths());
        assertEquals(List.of("none worth noting"), extraction.weaknesses());
    }
}
