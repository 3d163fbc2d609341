package com.rostrum.debate.provider;

import com.rostrum.debate.config.RostrumRuntimeProperties;
import com.rostrum.debate.config.TextGenerationProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.concurrent.ExecutorService;

/**
 * Resolves the text-generation backend and hands out one call-policy-wrapped client per participant.
 */
@Service
public class TextGenerationGateway {

    private final RostrumRuntimeProperties rostrumRuntimeProperties;
    private final TextGenerationProperties textGenerationProperties;
    private final MockTextGenerationClient mockTextGenerationClient;
    private final ExecutorService textGenerationAttemptExecutor;

    public TextGenerationGateway(
            RostrumRuntimeProperties rostrumRuntimeProperties,
            TextGenerationProperties textGenerationProperties,
            MockTextGenerationClient mockTextGenerationClient,
            @Qualifier("textGenerationAttemptExecutor") ExecutorService textGenerationAttemptExecutor
    ) {
        this.rostrumRuntimeProperties = rostrumRuntimeProperties;
        this.textGenerationProperties = textGenerationProperties;
        this.mockTextGenerationClient = mockTextGenerationClient;
        this.textGenerationAttemptExecutor = textGenerationAttemptExecutor;
    }

    /**
     * Creates a fresh client for one participant. Request spacing is tracked per returned instance.
     */
    public TextGenerationClient clientFor(String participantName) {
        if (!StringUtils.hasText(participantName)) {
            throw new IllegalArgumentException("participantName is required");
        }
        if (!rostrumRuntimeProperties.isMockProvider()) {
            throw new IllegalStateException("Live text generation is not implemented; enable rostrum.mock-provider");
        }
        return new RetryingTextGenerationClient(
                participantName.trim(),
                mockTextGenerationClient,
                textGenerationAttemptExecutor,
                textGenerationProperties
        );
    }
}
