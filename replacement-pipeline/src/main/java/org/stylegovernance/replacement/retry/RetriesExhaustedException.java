package org.stylegovernance.replacement.retry;

import lombok.Getter;

/**
 * A unit of work failed on every attempt its policy allowed. The last failure is kept as the cause.
 */
@Getter
public class RetriesExhaustedException extends RuntimeException {
    private final int attempts;

    public RetriesExhaustedException(int attempts, Exception lastFailure) {
        super("Failed after " + attempts + " attempts. Last error: " + lastFailure.getMessage(), lastFailure);
        this.attempts = attempts;
    }
}
