package com.specharvest.infrastructure.resilience;

import com.specharvest.domain.ports.Channel;
import com.specharvest.domain.ports.FetchException;
import com.specharvest.domain.support.CancellationToken;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs fetch operations under a linear backoff retry policy.
 *
 * <p>Attempt {@code n} that fails waits {@code baseDelay * n} before the next
 * one, and a cancellation ends that wait at once. When a failure is a 403
 * or 429 the channel is rotated before the next attempt. Credential exhaustion and cancellation are never retried. When every
 * attempt fails the last failure is wrapped in a
 * {@link FetchException.Reason#RETRIES_EXHAUSTED} exception.</p>
 */
public class ResilientFetcher {

    private static final Logger logger = LoggerFactory.getLogger(ResilientFetcher.class);

    @FunctionalInterface
    public interface FetchOperation<T> {
        T fetch(Channel channel) throws FetchException;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final CancellationToken cancellation;

    public ResilientFetcher(int maxAttempts, Duration baseDelay, CancellationToken cancellation) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.cancellation = cancellation;
    }

    public <T> T withRetry(String operationName, Channel channel, FetchOperation<T> operation) throws FetchException {
        return withRetry(operationName, channel, operation, maxAttempts, baseDelay);
    }

    public <T> T withRetry(String operationName,
                           Channel channel,
                           FetchOperation<T> operation,
                           int attempts,
                           Duration delay) throws FetchException {
        long delayMillis = delay.toMillis();

        // the backoff is waited out on the cancellation token inside the attempt,
        // so resilience4j itself never sleeps
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(attempts)
            .intervalBiFunction((attempt, outcome) -> 0L)
            .retryOnException(ResilientFetcher::isRetryable)
            .build();

        Retry retry = Retry.of(operationName, config);
        retry.getEventPublisher().onRetry(event -> {
            Throwable failure = event.getLastThrowable();
            logger.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                operationName, event.getNumberOfRetryAttempts(), attempts,
                delayMillis * event.getNumberOfRetryAttempts(), failure == null ? "unknown" : failure.getMessage());
            if (failure instanceof FetchException fetchFailure
                && fetchFailure.isRateLimitedOrBlocked()
                && channel.rotate()) {
                logger.info("Rotated {} channel after status {}", channel.kind(), fetchFailure.getStatusCode());
            }
        });

        AtomicInteger attempt = new AtomicInteger();
        try {
            return retry.executeCallable(() -> {
                int current = attempt.incrementAndGet();
                if (current > 1 && !cancellation.pause(Duration.ofMillis(delayMillis * (current - 1)))) {
                    throw FetchException.cancelled();
                }
                cancellation.throwIfCancelled();
                return operation.fetch(channel);
            });
        } catch (FetchException e) {
            if (e.isTerminal()) {
                throw e;
            }
            logger.error("{} failed after {} attempts: {}", operationName, attempts, e.getMessage());
            throw FetchException.retriesExhausted(attempts, e);
        } catch (Exception e) {
            throw new IllegalStateException("Unexpected failure in " + operationName, e);
        }
    }

    static boolean isRetryable(Throwable failure) {
        return failure instanceof FetchException fetchFailure && !fetchFailure.isTerminal();
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
