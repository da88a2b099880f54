package org.stylegovernance.replacement.mutation;

import org.stylegovernance.replacement.ir.OperationKind;

import reactor.core.publisher.Mono;

/**
 * Port for rewriting one element's assignment in the host document.
 *
 * This is the only place that knows how the document is read and written; the engine sees element ids
 * and outcomes, never host-specific node shapes.
 */
public interface MutationApplier {

    String UNKNOWN_ELEMENT_NAME = "Unknown";

    /**
     * Replace {@code sourceId} with {@code targetId} on the element.
     * Returns a cold Mono; each subscription is one attempt. An error means this attempt failed for this
     * element. Signal a fault that makes further work pointless (the host went away, an invariant broke)
     * with {@link org.stylegovernance.replacement.CatastrophicReplacementException}; it aborts the
     * operation instead of being retried.
     */
    Mono<Void> applyReplacement(OperationKind kind, String elementId, String sourceId, String targetId);

    /** Human readable name of the element for failure reports. */
    default String displayName(String elementId) {
        return UNKNOWN_ELEMENT_NAME;
    }
}
