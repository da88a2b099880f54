package org.stylegovernance.replacement;

import org.stylegovernance.replacement.ir.ErrorKind;

/**
 * The request is not acceptable. Raised before any side effect.
 */
public class ReplacementValidationException extends ReplacementException {
    public ReplacementValidationException(String message) {
        super(ErrorKind.VALIDATION, message);
    }

    public ReplacementValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION, message, cause);
    }
}
