package org.stylegovernance.replacement.checkpoint;

import org.stylegovernance.replacement.ir.Checkpoint;

import reactor.core.publisher.Mono;

/**
 * Port for taking a recoverable snapshot of the document (a version-history entry, a backup, a test
 * recorder).
 *
 * Called exactly once per operation, before any element is touched. A failed Mono means no snapshot
 * exists and the operation must not mutate anything.
 */
public interface CheckpointProvider {

    /** Save a checkpoint under the given title. Returns a cold Mono; subscription triggers the save. */
    Mono<Checkpoint> createCheckpoint(String title);
}
