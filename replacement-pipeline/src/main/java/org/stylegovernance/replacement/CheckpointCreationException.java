package org.stylegovernance.replacement;

import org.stylegovernance.replacement.ir.ErrorKind;

/**
 * The safety snapshot could not be taken. No element was mutated, so the whole operation can be retried.
 */
public class CheckpointCreationException extends ReplacementException {
    public CheckpointCreationException(String message, Throwable cause) {
        super(ErrorKind.CHECKPOINT, message, cause);
    }
}
