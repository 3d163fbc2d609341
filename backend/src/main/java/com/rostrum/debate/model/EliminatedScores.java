package com.rostrum.debate.model;

public record EliminatedScores(
        double highest,
        double lowest
) {
}
