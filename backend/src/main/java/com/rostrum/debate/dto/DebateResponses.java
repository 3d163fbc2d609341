package com.rostrum.debate.dto;

import com.rostrum.debate.model.DebateProgress;
import com.rostrum.debate.model.DebateSide;
import com.rostrum.debate.model.DebateStatus;
import com.rostrum.debate.model.DebateTurn;
import com.rostrum.debate.model.FinalScores;
import com.rostrum.debate.model.JudgeResult;

import java.time.Instant;
import java.util.List;

public final class DebateResponses {

    private DebateResponses() {
    }

    public record DebateCreated(
            String debateId,
            DebateStatus status
    ) {
    }

    public record DebateStatusView(
            String debateId,
            String topic,
            String background,
            DebateStatus status,
            int maxRounds,
            List<String> judgeNames,
            List<DebateTurn> messages,
            List<JudgeResult> judgeResults,
            DebateSide winner,
            FinalScores finalScores,
            String errorMessage,
            DebateProgress progress,
            Instant createdAt,
            Instant updatedAt
    ) {
    }

    public record CleanupResult(
            int archived
    ) {
    }
}
