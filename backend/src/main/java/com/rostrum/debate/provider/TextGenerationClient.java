package com.rostrum.debate.provider;

import java.util.function.Consumer;

/**
 * Provider abstraction for debater turns and judge evaluations.
 */
public interface TextGenerationClient {

    /**
     * Generates text for the request.
     *
     * @param chunkListener receives the text accumulated so far each time more arrives; may be {@code null}
     * @throws TextGenerationException when the backend call fails
     */
    TextGenerationResponse generate(TextGenerationRequest request, Consumer<String> chunkListener);
}
