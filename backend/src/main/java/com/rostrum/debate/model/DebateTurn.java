package com.rostrum.debate.model;

import java.time.Instant;

/**
 * One utterance of one side. Round and side are implied by the turn's position in the transcript.
 */
public record DebateTurn(
        DebateSide side,
        String text,
        Instant timestamp
) {
}
