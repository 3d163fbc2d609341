package com.rostrum.debate.provider;

import com.rostrum.debate.config.TextGenerationProperties;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Per-participant client that spaces requests, bounds each attempt in wall-clock time and retries
 * retryable failures with jittered exponential backoff.
 *
 * <p>Every attempt, retries included, starts at least the configured interval after the previous
 * attempt of the same client started. Chunks streamed by an attempt that has timed out or finished
 * are dropped.
 */
public class RetryingTextGenerationClient implements TextGenerationClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingTextGenerationClient.class);

    private final String name;
    private final TextGenerationClient delegate;
    private final ExecutorService attemptExecutor;
    private final long minRequestIntervalNanos;
    private final Object spacingLock = new Object();
    private final Retry retry;
    private final TimeLimiter timeLimiter;

    private long lastRequestStartNanos;
    private boolean requestStarted;

    public RetryingTextGenerationClient(
            String name,
            TextGenerationClient delegate,
            ExecutorService attemptExecutor,
            TextGenerationProperties properties
    ) {
        this.name = Objects.requireNonNull(name, "name is required");
        this.delegate = Objects.requireNonNull(delegate, "delegate is required");
        this.attemptExecutor = Objects.requireNonNull(attemptExecutor, "attemptExecutor is required");
        Objects.requireNonNull(properties, "properties are required");

        this.minRequestIntervalNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, properties.getMinRequestIntervalMs()));
        this.retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(Math.max(1, properties.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        Duration.ofMillis(Math.max(1L, properties.getInitialBackoffMs())),
                        Math.max(1.0, properties.getBackoffMultiplier()),
                        properties.getRandomizationFactor(),
                        Duration.ofMillis(Math.max(1L, properties.getMaxBackoffMs()))
                ))
                .retryOnException(TextGenerationFailureClassifier::isRetryable)
                .build());
        this.timeLimiter = TimeLimiter.of(name, TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(Math.max(1L, properties.getAttemptTimeoutMs())))
                .cancelRunningFuture(true)
                .build());

        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying text generation for {} (attempt {} failed, next in {} ms): {}",
                name,
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "unknown" : event.getLastThrowable().getMessage()
        ));
    }

    @Override
    public TextGenerationResponse generate(TextGenerationRequest request, Consumer<String> chunkListener) {
        Objects.requireNonNull(request, "request is required");
        try {
            return retry.executeCallable(() -> attempt(request, chunkListener));
        } catch (TextGenerationException ex) {
            throw ex;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw TextGenerationException.interrupted(ex);
        } catch (TimeoutException ex) {
            throw TextGenerationException.timeout(name + " exceeded the attempt time limit", ex);
        } catch (Exception ex) {
            Throwable cause = TextGenerationFailureClassifier.unwrap(ex);
            if (cause instanceof TextGenerationException textGenerationException) {
                throw textGenerationException;
            }
            String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
            throw new TextGenerationException(message, null, TextGenerationFailureClassifier.isRetryable(cause), cause);
        }
    }

    private TextGenerationResponse attempt(TextGenerationRequest request, Consumer<String> chunkListener)
            throws Exception {
        awaitRequestSlot();
        log.debug("Sending text generation request for {} as {}", name, request.role().userTag());

        AttemptChunkGate gate = new AttemptChunkGate(chunkListener);
        TextGenerationResponse response;
        try {
            response = timeLimiter.executeFutureSupplier(() -> submitAttempt(request, gate));
        } finally {
            gate.close();
        }
        if (response == null || response.text() == null || response.text().isBlank()) {
            throw TextGenerationException.emptyStream(name + " returned no content");
        }
        return response;
    }

    private void awaitRequestSlot() throws InterruptedException {
        synchronized (spacingLock) {
            if (requestStarted) {
                long waitNanos = lastRequestStartNanos + minRequestIntervalNanos - System.nanoTime();
                if (waitNanos > 0) {
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                }
            }
            lastRequestStartNanos = System.nanoTime();
            requestStarted = true;
        }
    }

    private Future<TextGenerationResponse> submitAttempt(TextGenerationRequest request, AttemptChunkGate gate) {
        return attemptExecutor.submit(() -> delegate.generate(request, gate.listener()));
    }

    /**
     * Forwards chunks of one attempt until it is closed.
     */
    private static final class AttemptChunkGate {

        private final Consumer<String> chunkListener;
        private boolean open = true;

        AttemptChunkGate(Consumer<String> chunkListener) {
            this.chunkListener = chunkListener;
        }

        Consumer<String> listener() {
            return chunkListener == null ? null : this::forward;
        }

        private synchronized void forward(String chunk) {
            if (open) {
                chunkListener.accept(chunk);
            }
        }

        synchronized void close() {
            open = false;
        }
    }

    public String getName() {
        return name;
    }
}
