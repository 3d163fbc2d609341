package com.rostrum.debate.model;

public record ParticipantCredential(
        String apiKey
) {
    @Override
    public String toString() {
        return "ParticipantCredential[apiKey=***]";
    }
}
