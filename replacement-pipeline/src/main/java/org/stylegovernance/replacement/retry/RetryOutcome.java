package org.stylegovernance.replacement.retry;

/**
 * One slot of a fan-out retry result: either the unit's value or a failure marker.
 */
public interface RetryOutcome<T> {

    boolean failed();

    static <T> RetryOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> RetryOutcome<T> failure(RetriesExhaustedException exhausted) {
        return new Failure<>(exhausted.getMessage(), exhausted.getAttempts(), exhausted);
    }

    /** The unit succeeded; {@code value} is null for units that complete without one. */
    record Success<T>(T value) implements RetryOutcome<T> {
        @Override
        public boolean failed() {
            return false;
        }
    }

    /** Failure marker standing in for a unit that exhausted its retries. */
    record Failure<T>(String error, int attempts, RetriesExhaustedException cause) implements RetryOutcome<T> {
        @Override
        public boolean failed() {
            return true;
        }
    }
}
