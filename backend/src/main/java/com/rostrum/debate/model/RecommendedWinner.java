package com.rostrum.debate.model;

public record RecommendedWinner(
        DebateSide side,
        String reason
) {
}
