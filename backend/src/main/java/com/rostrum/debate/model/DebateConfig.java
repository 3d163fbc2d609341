package com.rostrum.debate.model;

import java.util.List;

/**
 * Participants and round count of one debate. Persisted with the session, credentials included.
 */
public record DebateConfig(
        ParticipantCredential pro,
        ParticipantCredential con,
        List<JudgeCredential> judges,
        int maxRounds
) {
    public static final int PANEL_SIZE = 6;
    public static final int MIN_ROUNDS = 1;
    public static final int MAX_ROUNDS = 50;

    public DebateConfig {
        judges = judges == null ? List.of() : List.copyOf(judges);
    }

    public ParticipantCredential credentialFor(DebateSide side) {
        return side == DebateSide.PRO ? pro : con;
    }
}
