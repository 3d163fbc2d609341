package com.rostrum.debate;

import com.rostrum.debate.model.CategoryRationales;
import com.rostrum.debate.model.CategoryScores;
import com.rostrum.debate.model.DebateConfig;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.DebateStatus;
import com.rostrum.debate.model.DebateTurn;
import com.rostrum.debate.model.JudgeCredential;
import com.rostrum.debate.model.JudgeResult;
import com.rostrum.debate.model.ParticipantCredential;
import com.rostrum.debate.model.SidePair;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class DebateTestFixtures {

    public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private DebateTestFixtures() {
    }

    public static DebateConfig config(int maxRounds) {
        List<JudgeCredential> judges = new ArrayList<>();
        for (int i = 1; i <= DebateConfig.PANEL_SIZE; i++) {
            judges.add(new JudgeCredential("Judge " + i, "judge-key-" + i));
        }
        return new DebateConfig(
                new ParticipantCredential("pro-key"),
                new ParticipantCredential("con-key"),
                judges,
                maxRounds
        );
    }

    public static DebateSession pendingSession(String id, int maxRounds) {
        return DebateSession.create(
                id,
                "Remote work should be the default for knowledge workers",
                "Post-pandemic office policy debate",
                config(maxRounds),
                NOW
        );
    }

    public static DebateSession sessionWithTurns(String id, int maxRounds, int turns, DebateStatus status) {
        DebateSession session = pendingSession(id, maxRounds).withStatus(status, NOW);
        for (int i = 0; i < turns; i++) {
            DebateSide side = DebateSide.forTurnIndex(i);
            Instant at = NOW.plusSeconds(i + 1L);
            session = session.withTurn(new DebateTurn(side, side.wireValue() + " speech " + (i + 1), at), at);
        }
        return session;
    }

    public static JudgeResult judgeResult(String name, CategoryScores pro, CategoryScores con) {
        return new JudgeResult(
                name,
                SidePair.of(pro.composite(), con.composite()),
                SidePair.of(pro, con),
                SidePair.of(CategoryRationales.uniform("fine"), CategoryRationales.uniform("fine")),
                "Solid debate",
                List.of("clear structure"),
                List.of("thin sourcing"),
                List.of("cite data"),
                null,
                "raw",
                1.0,
                false
        );
    }

    public static List<JudgeResult> panel(CategoryScores pro, CategoryScores con) {
        List<JudgeResult> results = new ArrayList<>();
        for (int i = 1; i <= DebateConfig.PANEL_SIZE; i++) {
            results.add(judgeResult("Judge " + i, pro, con));
        }
        return results;
    }

    /**
     * Evaluation text in the layout judges are asked to answer with.
     */
    public static String judgeText(CategoryScores pro, CategoryScores con, String winner) {
        return "PRO SCORES\n"
                + "Logic: " + pro.logic() + "\n"
                + "Evidence: " + pro.evidence() + "\n"
                + "Rebuttal: " + pro.rebuttal() + "\n"
                + "Expression: " + pro.expression() + "\n"
                + "\n"
                + "CON SCORES\n"
                + "Logic: " + con.logic() + "\n"
                + "Evidence: " + con.evidence() + "\n"
                + "Rebuttal: " + con.rebuttal() + "\n"
                + "Expression: " + con.expression() + "\n"
                + "\n"
                + "SCORE RATIONALE\n"
                + "Pro logic: Tight reasoning.\n"
                + "Con evidence: Too few sources.\n"
                + "\n"
                + "STRENGTHS: direct clash, clear framing\n"
                + "WEAKNESSES: repetition\n"
                + "SUGGESTIONS: quantify the claims\n"
                + "OVERALL: Competitive exchange.\n"
                + "RECOMMENDED WINNER: " + winner + " - better weighing\n";
    }
}
