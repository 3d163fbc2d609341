package com.rostrum.debate.provider;

import org.springframework.util.StringUtils;

import java.util.Objects;

/**
 * Fully-resolved payload of a single text-generation call.
 */
public record TextGenerationRequest(
        TextGenerationRole role,
        String apiKey,
        String prompt,
        String conversationId
) {
    public TextGenerationRequest {
        Objects.requireNonNull(role, "role is required");

        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException("apiKey is required");
        }
        apiKey = apiKey.trim();

        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("prompt is required");
        }

        conversationId = StringUtils.hasText(conversationId) ? conversationId.trim() : null;
    }

    @Override
    public String toString() {
        return "TextGenerationRequest[role=" + role + ", promptLength=" + prompt.length()
                + ", conversationId=" + conversationId + "]";
    }
}
