package org.stylegovernance.replacement;

import org.stylegovernance.replacement.ir.ErrorKind;

/**
 * Processing cannot continue: an internal invariant broke or the host reported a systemic fault. Never
 * retried and never recorded as a per-element failure.
 */
public class CatastrophicReplacementException extends ReplacementException {
    public CatastrophicReplacementException(String message) {
        super(ErrorKind.PROCESSING, message);
    }

    public CatastrophicReplacementException(String message, Throwable cause) {
        super(ErrorKind.PROCESSING, message, cause);
    }
}
