package com.rostrum.debate.provider;

import lombok.Getter;

/**
 * Failure of a text-generation call, tagged with whether the call may be attempted again.
 */
@Getter
public class TextGenerationException extends RuntimeException {

    private final Integer statusCode;
    private final boolean retryable;

    public TextGenerationException(String message, Integer statusCode, boolean retryable, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public static TextGenerationException httpStatus(int statusCode, String detail) {
        return new TextGenerationException(
                "Text generation backend error: " + statusCode + (detail == null ? "" : " " + detail),
                statusCode,
                isRetryableStatus(statusCode),
                null
        );
    }

    public static TextGenerationException timeout(String detail, Throwable cause) {
        return new TextGenerationException("Text generation timed out: " + detail, 408, true, cause);
    }

    public static TextGenerationException connectionReset(String detail, Throwable cause) {
        return new TextGenerationException("Text generation connection reset: " + detail, null, true, cause);
    }

    public static TextGenerationException emptyStream(String detail) {
        return new TextGenerationException("No data received from stream: " + detail, null, true, null);
    }

    public static TextGenerationException malformedResponse(String detail) {
        return new TextGenerationException("Invalid response from text generation backend: " + detail, null, false, null);
    }

    public static TextGenerationException interrupted(Throwable cause) {
        return new TextGenerationException("Text generation interrupted", null, false, cause);
    }

    public static TextGenerationException fatal(String detail, Throwable cause) {
        return new TextGenerationException(detail, null, false, cause);
    }

    static boolean isRetryableStatus(int statusCode) {
        return statusCode == 408 || statusCode == 429 || (statusCode >= 500 && statusCode <= 599);
    }
}
