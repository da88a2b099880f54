package org.stylegovernance.replacement.mutation;

import org.stylegovernance.replacement.ir.OperationKind;

import reactor.core.publisher.Mono;

/**
 * Port for checking that a style or token id refers to something that exists in the document or its
 * libraries.
 */
public interface AssignmentResolver {

    /** Emits true if the id resolves to an assignment of the given kind. */
    Mono<Boolean> resolves(OperationKind kind, String assignmentId);

    /** Resolver for hosts that cannot look assignments up ahead of time. */
    static AssignmentResolver acceptingAll() {
        return (kind, assignmentId) -> Mono.just(true);
    }
}
