package org.stylegovernance.replacement.retry;

import java.time.Duration;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Predicate;

import lombok.With;

/**
 * How a single unit of work is retried.
 *
 * @param maxAttempts total calls allowed, including the first; 1 means no retries
 * @param delays pause before each retry, indexed by the attempt that just failed; the last value is reused
 *               once attempts outnumber the configured delays
 * @param onRetry optional observer called with (attempt number, failure) before each retry
 * @param fatal failures matching this predicate are neither retried nor turned into failure markers
 */
@With
public record RetryPolicy(
    int maxAttempts,
    List<Duration> delays,
    BiConsumer<Integer, Exception> onRetry,
    Predicate<Throwable> fatal
) {
    public static final RetryPolicy DEFAULT = of(3, Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1 but was " + maxAttempts);
        }
        if (delays == null || delays.isEmpty()) {
            throw new IllegalArgumentException("At least one retry delay is required");
        }
        if (delays.stream().anyMatch(d -> d == null || d.isNegative())) {
            throw new IllegalArgumentException("Retry delays must be non-negative: " + delays);
        }
        delays = List.copyOf(delays);
        fatal = fatal != null ? fatal : t -> false;
    }

    public static RetryPolicy of(int maxAttempts, Duration... delays) {
        return new RetryPolicy(maxAttempts, List.of(delays), null, null);
    }

    public static RetryPolicy ofMillis(int maxAttempts, List<Long> delaysMillis) {
        return new RetryPolicy(maxAttempts, delaysMillis.stream().map(Duration::ofMillis).toList(), null, null);
    }

    /** Delay to wait after the given (1-based) attempt failed. */
    public Duration delayAfterAttempt(int attempt) {
        return delays.get(Math.min(attempt, delays.size()) - 1);
    }

    boolean isFatal(Throwable failure) {
        return fatal.test(failure);
    }

    void notifyRetry(int attempt, Exception failure) {
        if (onRetry != null) {
            onRetry.accept(attempt, failure);
        }
    }
}
