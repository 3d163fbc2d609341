package com.rostrum.debate.model;

/**
 * Live, non-durable view of a running debate. Rebuilt from scratch whenever a session is restored.
 */
public record DebateProgress(
        int currentRound,
        int totalRounds,
        double percentage,
        DebateSide currentSpeaker,
        boolean thinking,
        String streamingText,
        DebateSide streamingSide,
        JudgingProgress judging
) {
    public static DebateProgress idle(int completedRounds, int totalRounds, DebateSide nextSpeaker) {
        return new DebateProgress(
                Math.min(completedRounds + 1, totalRounds),
                totalRounds,
                percentage(completedRounds, totalRounds),
                nextSpeaker,
                false,
                "",
                null,
                null
        );
    }

    public DebateProgress speaking(DebateSide side, boolean isThinking, String text) {
        return new DebateProgress(currentRound, totalRounds, percentage, side, isThinking, text, side, judging);
    }

    public DebateProgress withJudging(JudgingProgress judgingProgress) {
        return new DebateProgress(currentRound, totalRounds, percentage, null, false, "", null, judgingProgress);
    }

    static double percentage(int completedRounds, int totalRounds) {
        if (totalRounds <= 0) {
            return 0.0;
        }
        return Math.min(100.0, (completedRounds * 100.0) / totalRounds);
    }
}
