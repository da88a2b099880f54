package org.stylegovernance.replacement.ir;

import java.time.Instant;

/**
 * A recoverable snapshot of the document taken before any mutation. Created exactly once per operation.
 */
public record Checkpoint(
    String title,
    Instant timestamp
) {}
