package org.stylegovernance.replacement.state;

import lombok.Getter;

/**
 * A component asked for a transition the lifecycle does not allow. Always a programming error, never an
 * expected business outcome.
 */
@Getter
public class IllegalStateTransitionException extends IllegalStateException {
    private final ReplacementState from;
    private final ReplacementState to;

    public IllegalStateTransitionException(ReplacementState from, ReplacementState to) {
        super("Illegal replacement state transition " + from.wireName() + " -> " + to.wireName());
        this.from = from;
        this.to = to;
    }
}
