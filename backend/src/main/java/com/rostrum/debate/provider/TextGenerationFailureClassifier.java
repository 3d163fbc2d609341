package com.rostrum.debate.provider;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Decides which text-generation failures are worth another attempt.
 */
public final class TextGenerationFailureClassifier {

    private TextGenerationFailureClassifier() {
    }

    public static boolean isRetryable(Throwable failure) {
        Throwable cause = unwrap(failure);
        if (cause instanceof TextGenerationException textGenerationException) {
            return textGenerationException.isRetryable();
        }
        return cause instanceof TimeoutException || cause instanceof IOException;
    }

    static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
