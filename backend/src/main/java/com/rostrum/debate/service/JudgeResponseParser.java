package com.rostrum.debate.service;

import com.rostrum.debate.model.CategoryRationales;
import com.rostrum.debate.model.CategoryScores;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.RecommendedWinner;
import com.rostrum.debate.model.ScoreCategory;
import com.rostrum.debate.model.SidePair;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads scores, rationales and commentary out of a judge's free-text evaluation.
 *
 * <p>Extraction never fails: anything that cannot be found falls back to a neutral default and is
 * reflected in {@link ScoreExtraction#confidence()}.
 */
public final class JudgeResponseParser {

    public static final int DEFAULT_SCORE = 75;
    static final int MIN_FOUND_SCORES = 2;
    static final int MAX_HIGHLIGHT_LENGTH = 99;
    static final String DEFAULT_RATIONALE = "No rationale provided";
    static final String DEFAULT_STRENGTH = "No specific strengths identified";
    static final String DEFAULT_WEAKNESS = "No specific weaknesses identified";
    static final String DEFAULT_SUGGESTION = "No specific suggestions provided";

    private static final String SIDE_PATTERN = "(pro|proposition|affirmative|con|opposition|negative)";
    private static final String CATEGORY_PATTERN =
            "(logic|reasoning|argument|evidence|support|rebuttal|refutation|response|expression|delivery|persuasiveness)";

    private static final Pattern SCORES_HEADER = Pattern.compile(
            "^[#*\\s]*" + SIDE_PATTERN + "(?:\\s+side)?(?:\\s+scores?)?[*\\s]*[:：]?\\s*$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern SCORE_LINE = Pattern.compile(
            "^[-*•\\s]*(?:" + SIDE_PATTERN + "\\s+)?" + CATEGORY_PATTERN + "[*\\s]*[:：=-]?\\s*(\\d{1,3})(?:\\s*/\\s*100)?\\b.*$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern RATIONALE_HEADER = Pattern.compile(
            "^[#*\\s]*(?:score\\s+)?(?:rationales?|justifications?)[*\\s]*[:：]?\\s*$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern RATIONALE_LINE = Pattern.compile(
            "^[-*•\\s]*" + SIDE_PATTERN + "\\s+" + CATEGORY_PATTERN + "[*\\s]*[:：-]\\s*(.+)$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern TEXT_SECTION_HEADER = Pattern.compile(
            "^[#*\\s]*(strengths?|weaknesses?|suggestions?|overall(?:\\s+comments?)?|summary)[*\\s]*(?:[:：]\\s*(.*))?$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern WINNER_LINE = Pattern.compile(
            "^[#*\\s]*recommended\\s+winner[*\\s]*[:：]?\\s*" + SIDE_PATTERN + "\\b[\\s\\-–—:,]*(.*)$",
            Pattern.CASE_INSENSITIVE
    );
    private static final Pattern HIGHLIGHT_SEPARATORS = Pattern.compile("[,.;\\n，。；、]");
    private static final Pattern BULLET_PREFIX = Pattern.compile("^(?:[-*•]+|\\d+[).])\\s*");

    private enum Section {
        NONE,
        PRO_SCORES,
        CON_SCORES,
        RATIONALE,
        STRENGTHS,
        WEAKNESSES,
        SUGGESTIONS,
        OVERALL
    }

    private JudgeResponseParser() {
    }

    public static ScoreExtraction extract(String text) {
        String source = text == null ? "" : text;

        Map<DebateSide, Map<ScoreCategory, Integer>> scores = new EnumMap<>(DebateSide.class);
        Map<DebateSide, Map<ScoreCategory, String>> rationales = new EnumMap<>(DebateSide.class);
        for (DebateSide side : DebateSide.values()) {
            scores.put(side, new EnumMap<>(ScoreCategory.class));
            rationales.put(side, new EnumMap<>(ScoreCategory.class));
        }
        Map<Section, StringBuilder> textSections = new EnumMap<>(Section.class);
        RecommendedWinner recommendedWinner = null;

        Section section = Section.NONE;
        for (String rawLine : source.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty()) {
                continue;
            }

            Matcher winner = WINNER_LINE.matcher(line);
            if (winner.matches()) {
                if (recommendedWinner == null) {
                    recommendedWinner = new RecommendedWinner(parseSide(winner.group(1)), winner.group(2).strip());
                }
                section = Section.NONE;
                continue;
            }

            Matcher scoresHeader = SCORES_HEADER.matcher(line);
            if (scoresHeader.matches()) {
                section = parseSide(scoresHeader.group(1)) == DebateSide.PRO ? Section.PRO_SCORES : Section.CON_SCORES;
                continue;
            }
            if (RATIONALE_HEADER.matcher(line).matches()) {
                section = Section.RATIONALE;
                continue;
            }
            Matcher textHeader = TEXT_SECTION_HEADER.matcher(line);
            if (textHeader.matches()) {
                section = textSectionFor(textHeader.group(1));
                appendLine(textSections, section, textHeader.group(2));
                continue;
            }

            switch (section) {
                case PRO_SCORES, CON_SCORES -> {
                    Matcher scoreLine = SCORE_LINE.matcher(line);
                    if (scoreLine.matches()) {
                        DebateSide side = scoreLine.group(1) != null
                                ? parseSide(scoreLine.group(1))
                                : (section == Section.PRO_SCORES ? DebateSide.PRO : DebateSide.CON);
                        recordScore(scores.get(side), parseCategory(scoreLine.group(2)), scoreLine.group(3));
                    }
                }
                case RATIONALE -> {
                    Matcher rationaleLine = RATIONALE_LINE.matcher(line);
                    if (rationaleLine.matches()) {
                        rationales.get(parseSide(rationaleLine.group(1)))
                                .putIfAbsent(parseCategory(rationaleLine.group(2)), rationaleLine.group(3).strip());
                    }
                }
                case STRENGTHS, WEAKNESSES, SUGGESTIONS, OVERALL -> appendLine(textSections, section, line);
                case NONE -> {
                    Matcher scoreLine = SCORE_LINE.matcher(line);
                    if (scoreLine.matches() && scoreLine.group(1) != null) {
                        recordScore(
                                scores.get(parseSide(scoreLine.group(1))),
                                parseCategory(scoreLine.group(2)),
                                scoreLine.group(3)
                        );
                    }
                }
            }
        }

        int found = scores.get(DebateSide.PRO).size() + scores.get(DebateSide.CON).size();
        int expected = DebateSide.values().length * ScoreCategory.values().length;
        boolean usable = found >= MIN_FOUND_SCORES;

        String overall = textOf(textSections, Section.OVERALL);
        if (overall.isEmpty()) {
            overall = source.strip();
        }

        return new ScoreExtraction(
                SidePair.of(
                        toScores(scores.get(DebateSide.PRO), usable),
                        toScores(scores.get(DebateSide.CON), usable)
                ),
                SidePair.of(
                        toRationales(rationales.get(DebateSide.PRO)),
                        toRationales(rationales.get(DebateSide.CON))
                ),
                highlights(textOf(textSections, Section.STRENGTHS), DEFAULT_STRENGTH),
                highlights(textOf(textSections, Section.WEAKNESSES), DEFAULT_WEAKNESS),
                highlights(textOf(textSections, Section.SUGGESTIONS), DEFAULT_SUGGESTION),
                overall,
                recommendedWinner,
                (double) found / expected
        );
    }

    static List<String> highlights(String sectionText, String fallback) {
        List<String> items = new ArrayList<>();
        for (String candidate : HIGHLIGHT_SEPARATORS.split(sectionText)) {
            String item = BULLET_PREFIX.matcher(candidate.strip()).replaceFirst("").strip();
            if (!item.isEmpty() && item.length() <= MAX_HIGHLIGHT_LENGTH) {
                items.add(item);
            }
        }
        if (items.isEmpty()) {
            items.add(fallback);
        }
        return items;
    }

    private static void recordScore(Map<ScoreCategory, Integer> sideScores, ScoreCategory category, String digits) {
        if (sideScores.containsKey(category)) {
            return;
        }
        int value = Integer.parseInt(digits);
        if (value >= 0 && value <= 100) {
            sideScores.put(category, value);
        }
    }

    private static CategoryScores toScores(Map<ScoreCategory, Integer> found, boolean usable) {
        if (!usable) {
            return CategoryScores.uniform(DEFAULT_SCORE);
        }
        return new CategoryScores(
                found.getOrDefault(ScoreCategory.LOGIC, DEFAULT_SCORE),
                found.getOrDefault(ScoreCategory.EVIDENCE, DEFAULT_SCORE),
                found.getOrDefault(ScoreCategory.REBUTTAL, DEFAULT_SCORE),
                found.getOrDefault(ScoreCategory.EXPRESSION, DEFAULT_SCORE)
        );
    }

    private static CategoryRationales toRationales(Map<ScoreCategory, String> found) {
        return new CategoryRationales(
                found.getOrDefault(ScoreCategory.LOGIC, DEFAULT_RATIONALE),
                found.getOrDefault(ScoreCategory.EVIDENCE, DEFAULT_RATIONALE),
                found.getOrDefault(ScoreCategory.REBUTTAL, DEFAULT_RATIONALE),
                found.getOrDefault(ScoreCategory.EXPRESSION, DEFAULT_RATIONALE)
        );
    }

    private static void appendLine(Map<Section, StringBuilder> textSections, Section section, String line) {
        if (line == null || line.isBlank()) {
            return;
        }
        StringBuilder builder = textSections.computeIfAbsent(section, ignored -> new StringBuilder());
        if (!builder.isEmpty()) {
            builder.append('\n');
        }
        builder.append(line.strip());
    }

    private static String textOf(Map<Section, StringBuilder> textSections, Section section) {
        StringBuilder builder = textSections.get(section);
        return builder == null ? "" : builder.toString().strip();
    }

    private static Section textSectionFor(String header) {
        String normalized = header.toLowerCase(Locale.ROOT);
        if (normalized.startsWith("strength")) {
            return Section.STRENGTHS;
        }
        if (normalized.startsWith("weakness")) {
            return Section.WEAKNESSES;
        }
        if (normalized.startsWith("suggestion")) {
            return Section.SUGGESTIONS;
        }
        return Section.OVERALL;
    }

    private static DebateSide parseSide(String token) {
        return switch (token.toLowerCase(Locale.ROOT)) {
            case "pro", "proposition", "affirmative" -> DebateSide.PRO;
            default -> DebateSide.CON;
        };
    }

    private static ScoreCategory parseCategory(String token) {
        return switch (token.toLowerCase(Locale.ROOT)) {
            case "logic", "reasoning", "argument" -> ScoreCategory.LOGIC;
            case "evidence", "support" -> ScoreCategory.EVIDENCE;
            case "rebuttal", "refutation", "response" -> ScoreCategory.REBUTTAL;
            default -> ScoreCategory.EXPRESSION;
        };
    }
}
