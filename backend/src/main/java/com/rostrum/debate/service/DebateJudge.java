package com.rostrum.debate.service;

import com.rostrum.debate.model.CategoryRationales;
import com.rostrum.debate.model.CategoryScores;
import com.rostrum.debate.model.DebateSession;
import com.rostrum.debate.model.JudgeCredential;
import com.rostrum.debate.model.JudgeResult;
import com.rostrum.debate.model.SidePair;
import com.rostrum.debate.provider.TextGenerationClient;
import com.rostrum.debate.provider.TextGenerationRequest;
import com.rostrum.debate.provider.TextGenerationResponse;
import com.rostrum.debate.provider.TextGenerationRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * One member of the judging panel. {@link #evaluate} always returns a complete verdict: when the
 * backend call or the reading of its answer fails, a neutral default verdict explains the failure.
 * An interrupted call is the one failure that propagates, so a stopping loop never records defaults.
 */
public class DebateJudge {

    private static final Logger log = LoggerFactory.getLogger(DebateJudge.class);

    private final JudgeCredential credential;
    private final TextGenerationClient client;

    public DebateJudge(JudgeCredential credential, TextGenerationClient client) {
        this.credential = Objects.requireNonNull(credential, "credential is required");
        this.client = Objects.requireNonNull(client, "client is required");
    }

    public JudgeResult evaluate(DebateSession session) {
        String rawText;
        try {
            TextGenerationResponse response = client.generate(
                    new TextGenerationRequest(
                            TextGenerationRole.JUDGE,
                            credential.apiKey(),
                            buildPrompt(session),
                            null
                    ),
                    null
            );
            rawText = response.text();
        } catch (RuntimeException ex) {
            if (Thread.currentThread().isInterrupted()) {
                throw ex;
            }
            log.warn("Judge {} could not evaluate debate {}: {}", getName(), session.id(), ex.getMessage());
            return degradedResult(getName(), "evaluation request failed: " + ex.getMessage());
        }

        try {
            ScoreExtraction extraction = JudgeResponseParser.extract(rawText);
            return new JudgeResult(
                    getName(),
                    SidePair.of(
                            extraction.scores().pro().composite(),
                            extraction.scores().con().composite()
                    ),
                    extraction.scores(),
                    extraction.rationales(),
                    extraction.overallComment(),
                    extraction.strengths(),
                    extraction.weaknesses(),
                    extraction.suggestions(),
                    extraction.recommendedWinner(),
                    rawText,
                    extraction.confidence(),
                    false
            );
        } catch (RuntimeException ex) {
            log.warn("Judge {} returned an unreadable evaluation for debate {}", getName(), session.id(), ex);
            return degradedResult(getName(), "evaluation could not be read: " + ex.getMessage());
        }
    }

    /**
     * Neutral verdict used when a judge fails. Every score is the default so the panel still aggregates.
     */
    static JudgeResult degradedResult(String judgeName, String reason) {
        CategoryScores scores = CategoryScores.uniform(JudgeResponseParser.DEFAULT_SCORE);
        CategoryRationales rationales = CategoryRationales.uniform("Default score; " + reason);
        return new JudgeResult(
                judgeName,
                SidePair.of(scores.composite(), scores.composite()),
                SidePair.of(scores, scores),
                SidePair.of(rationales, rationales),
                "Judge " + judgeName + " could not score this debate (" + reason + "); default scores were applied.",
                List.of("Not evaluated"),
                List.of("Not evaluated"),
                List.of("Not evaluated"),
                null,
                null,
                0.0,
                true
        );
    }

    String buildPrompt(DebateSession session) {
        return "You are judge \"" + getName() + "\" on a six-member panel scoring a formal debate.\n"
                + "Motion: " + session.topic() + "\n"
                + "Background: " + DebatePromptFormatter.background(session.background()) + "\n\n"
                + "Full transcript:\n"
                + DebatePromptFormatter.transcript(session.messages()) + "\n\n"
                + "Score each side from 0 to 100 on logic, evidence, rebuttal and expression. "
                + "Answer in exactly this layout:\n"
                + "PRO SCORES\n"
                + "Logic: <0-100>\nEvidence: <0-100>\nRebuttal: <0-100>\nExpression: <0-100>\n\n"
                + "CON SCORES\n"
                + "Logic: <0-100>\nEvidence: <0-100>\nRebuttal: <0-100>\nExpression: <0-100>\n\n"
                + "SCORE RATIONALE\n"
                + "Pro logic: <one sentence>\n(one line for each side and category)\n\n"
                + "STRENGTHS: <comma separated>\n"
                + "WEAKNESSES: <comma separated>\n"
                + "SUGGESTIONS: <comma separated>\n"
                + "OVERALL: <short commentary>\n"
                + "RECOMMENDED WINNER: <pro or con> - <reason>";
    }

    public String getName() {
        return credential.name();
    }
}
