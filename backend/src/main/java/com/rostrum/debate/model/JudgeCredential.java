package com.rostrum.debate.model;

public record JudgeCredential(
        String name,
        String apiKey
) {
    @Override
    public String toString() {
        return "JudgeCredential[name=" + name + ", apiKey=***]";
    }
}
