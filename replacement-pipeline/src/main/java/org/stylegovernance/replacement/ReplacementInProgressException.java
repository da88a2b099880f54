package org.stylegovernance.replacement;

import org.stylegovernance.replacement.state.ReplacementState;

import lombok.Getter;

/**
 * A replacement was requested while the document still has one that is running or not yet acknowledged.
 */
@Getter
public class ReplacementInProgressException extends IllegalStateException {
    private final ReplacementState currentState;

    public ReplacementInProgressException(ReplacementState currentState) {
        super("A replacement is already in progress on this document (state: " + currentState.wireName() + ")");
        this.currentState = currentState;
    }
}
