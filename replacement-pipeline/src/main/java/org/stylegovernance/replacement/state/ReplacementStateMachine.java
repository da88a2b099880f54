package org.stylegovernance.replacement.state;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import lombok.extern.slf4j.Slf4j;

/**
 * Guards the lifecycle of the operation running against one document. Only the transitions listed by
 * {@link ReplacementState#successors()} are applied; anything else is logged and leaves the state alone.
 *
 * <p>Thread safe. Listeners are called after the state has changed, on the thread that changed it; a
 * failing listener is logged and does not affect the transition or other listeners.
 */
@Slf4j
public class ReplacementStateMachine {

    /** Notified of every applied transition. */
    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(ReplacementState from, ReplacementState to);
    }

    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private ReplacementState state = ReplacementState.IDLE;

    public synchronized ReplacementState getState() {
        return state;
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    /**
     * Attempt a transition.
     *
     * @return true if applied, false if rejected (state unchanged)
     */
    public boolean transitionTo(ReplacementState next) {
        ReplacementState previous;
        synchronized (this) {
            previous = state;
            if (!previous.canTransitionTo(next)) {
                log.warn("Rejected replacement state transition {} -> {}", previous.wireName(), next.wireName());
                return false;
            }
            state = next;
        }
        log.debug("Replacement state {} -> {}", previous.wireName(), next.wireName());
        notifyListeners(previous, next);
        return true;
    }

    /**
     * Like {@link #transitionTo} but treats a rejection as the programming error it is.
     *
     * @throws IllegalStateTransitionException if the transition is not allowed from the current state
     */
    public void requireTransition(ReplacementState next) {
        var current = getState();
        if (!transitionTo(next)) {
            throw new IllegalStateTransitionException(current, next);
        }
    }

    private void notifyListeners(ReplacementState from, ReplacementState to) {
        for (var listener : listeners) {
            try {
                listener.onTransition(from, to);
            } catch (RuntimeException e) {
                log.warn("State transition listener failed for {} -> {}", from.wireName(), to.wireName(), e);
            }
        }
    }
}
