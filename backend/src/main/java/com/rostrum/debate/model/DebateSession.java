package com.rostrum.debate.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable state of one debate. Every mutation produces a new value with a fresh {@code updatedAt},
 * so a reference obtained by a reader is always a consistent snapshot.
 */
public record DebateSession(
        String id,
        String topic,
        String background,
        DebateStatus status,
        List<DebateTurn> messages,
        List<JudgeResult> judgeResults,
        DebateSide winner,
        FinalScores finalScores,
        String errorMessage,
        DebateConfig config,
        Instant createdAt,
        Instant updatedAt
) {
    public DebateSession {
        messages = messages == null ? List.of() : List.copyOf(messages);
        judgeResults = judgeResults == null ? List.of() : List.copyOf(judgeResults);
    }

    public static DebateSession create(
            String id,
            String topic,
            String background,
            DebateConfig config,
            Instant now
    ) {
        return new DebateSession(
                id,
                topic,
                background == null ? "" : background,
                DebateStatus.PENDING,
                List.of(),
                List.of(),
                null,
                null,
                null,
                config,
                now,
                now
        );
    }

    public DebateSession withStatus(DebateStatus nextStatus, Instant now) {
        return new DebateSession(id, topic, background, nextStatus, messages, judgeResults, winner,
                finalScores, errorMessage, config, createdAt, now);
    }

    public DebateSession withTurn(DebateTurn turn, Instant now) {
        List<DebateTurn> nextMessages = new ArrayList<>(messages);
        nextMessages.add(turn);
        return new DebateSession(id, topic, background, status, nextMessages, judgeResults, winner,
                finalScores, errorMessage, config, createdAt, now);
    }

    public DebateSession withVerdict(
            List<JudgeResult> results,
            FinalScores scores,
            DebateSide winningSide,
            Instant now
    ) {
        return new DebateSession(id, topic, background, DebateStatus.COMPLETED, messages, results, winningSide,
                scores, null, config, createdAt, now);
    }

    public DebateSession withError(String message, Instant now) {
        return new DebateSession(id, topic, background, DebateStatus.ERROR, messages, judgeResults, winner,
                finalScores, message, config, createdAt, now);
    }

    /**
     * Number of rounds in which both sides have spoken.
     */
    @JsonIgnore
    public int completedRounds() {
        return messages.size() / 2;
    }

    @JsonIgnore
    public DebateSide nextSide() {
        return DebateSide.forTurnIndex(messages.size());
    }
}
