package org.stylegovernance.replacement.retry;

import java.util.List;
import java.util.function.Supplier;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Retry with backoff for single units of work, and the same applied independently across a sequence of
 * units.
 *
 * <p>A unit is a supplier of a cold {@link Mono}; every attempt calls the supplier again. A successful
 * attempt returns without any delay. Suspension only happens between attempts of a failing unit.
 */
@Slf4j
public final class Retries {

    private Retries() {}

    /**
     * Run the unit, retrying failures according to the policy. Fails with {@link RetriesExhaustedException}
     * once every attempt has failed. Failures the policy deems fatal propagate untouched on first sight.
     */
    public static <T> Mono<T> retryWithBackoff(Supplier<? extends Mono<T>> unitOfWork, RetryPolicy policy) {
        return attempt(unitOfWork, policy, 1);
    }

    private static <T> Mono<T> attempt(Supplier<? extends Mono<T>> unitOfWork, RetryPolicy policy, int attempt) {
        return Mono.<T>defer(unitOfWork)
            .onErrorResume(failure -> !policy.isFatal(failure), failure -> {
                var normalized = normalize(failure);
                if (attempt >= policy.maxAttempts()) {
                    return Mono.error(new RetriesExhaustedException(attempt, normalized));
                }
                var delay = policy.delayAfterAttempt(attempt);
                log.atDebug().setMessage("Attempt {} failed ({}), retrying in {}ms")
                    .addArgument(attempt)
                    .addArgument(normalized::getMessage)
                    .addArgument(delay::toMillis)
                    .log();
                policy.notifyRetry(attempt, normalized);
                return Mono.delay(delay).then(attempt(unitOfWork, policy, attempt + 1));
            });
    }

    /**
     * Retry every unit independently with the same policy, running all of them at once.
     * See {@link #batchRetry(List, RetryPolicy, int)}.
     */
    public static <T> Mono<List<RetryOutcome<T>>> batchRetry(List<? extends Supplier<? extends Mono<T>>> unitsOfWork,
                                                             RetryPolicy policy) {
        return batchRetry(unitsOfWork, policy, Math.max(1, unitsOfWork.size()));
    }

    /**
     * Retry every unit independently with the same policy. The result has one slot per unit, in input order
     * regardless of completion order. A unit that exhausts its retries fills its slot with a failure marker
     * instead of failing the whole call; only fatal failures abort.
     *
     * @param maxInFlight how many units may be in progress at once
     */
    public static <T> Mono<List<RetryOutcome<T>>> batchRetry(List<? extends Supplier<? extends Mono<T>>> unitsOfWork,
                                                             RetryPolicy policy,
                                                             int maxInFlight) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be at least 1 but was " + maxInFlight);
        }
        return Flux.fromIterable(unitsOfWork)
            .flatMapSequential(unit -> retryWithBackoff(unit, policy)
                    .map(RetryOutcome::success)
                    .defaultIfEmpty(RetryOutcome.success(null))
                    .onErrorResume(RetriesExhaustedException.class, e -> Mono.just(RetryOutcome.failure(e))),
                maxInFlight)
            .collectList();
    }

    /**
     * True only for failure markers produced by {@link #batchRetry}; false for null, successes and anything
     * else.
     */
    public static boolean isRetryFailure(Object value) {
        return value instanceof RetryOutcome.Failure;
    }

    /**
     * Bring any failure value into one shape: an {@link Exception} with a non-blank message. Exceptions that
     * already have a message are returned as they are.
     */
    public static Exception normalize(Object failure) {
        if (failure instanceof Exception) {
            var exception = (Exception) failure;
            if (exception.getMessage() != null && !exception.getMessage().isBlank()) {
                return exception;
            }
            return new NormalizedFailureException(exception.getClass().getSimpleName(), exception);
        }
        if (failure instanceof Throwable) {
            var throwable = (Throwable) failure;
            var message = throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
            return new NormalizedFailureException(message, throwable);
        }
        return new NormalizedFailureException(failure == null ? "Unknown error" : String.valueOf(failure));
    }
}
