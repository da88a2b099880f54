package org.stylegovernance.replacement.state;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a replacement. There is no cancelled state: once a checkpoint exists the operation is
 * always driven to complete or error.
 */
public enum ReplacementState {
    IDLE("idle"),
    VALIDATING("validating"),
    CREATING_CHECKPOINT("creating_checkpoint"),
    PROCESSING("processing"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    ReplacementState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == ERROR;
    }

    /** States reachable from this one. {@code VALIDATING -> IDLE} is the cancellation path. */
    public Set<ReplacementState> successors() {
        switch (this) {
            case IDLE:
                return EnumSet.of(VALIDATING);
            case VALIDATING:
                return EnumSet.of(CREATING_CHECKPOINT, ERROR, IDLE);
            case CREATING_CHECKPOINT:
                return EnumSet.of(PROCESSING, ERROR);
            case PROCESSING:
                return EnumSet.of(COMPLETE, ERROR);
            case COMPLETE:
            case ERROR:
                return EnumSet.of(IDLE);
            default:
                throw new IllegalStateException("Unknown state " + this);
        }
    }

    public boolean canTransitionTo(ReplacementState next) {
        return successors().contains(next);
    }
}
