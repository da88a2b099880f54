package org.stylegovernance.replacement.retry;

/**
 * Stands in for a failure that did not arrive as an {@link Exception} with a usable message, so that
 * everything downstream of the retry engine can rely on a readable reason.
 */
public class NormalizedFailureException extends RuntimeException {
    public NormalizedFailureException(String message) {
        super(message);
    }

    public NormalizedFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
