package com.rostrum.debate.provider;

/**
 * Final text of a call plus the backend's conversation identifier for continuing it.
 */
public record TextGenerationResponse(
        String text,
        String conversationId
) {
}
