package org.stylegovernance.replacement;

import org.stylegovernance.replacement.ir.ErrorKind;

import lombok.Getter;

/**
 * A failure that ends a replacement in the error state.
 */
@Getter
public abstract class ReplacementException extends RuntimeException {
    private final ErrorKind errorKind;

    protected ReplacementException(ErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    protected ReplacementException(ErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }
}
