package org.stylegovernance.replacement.batch;

import org.stylegovernance.replacement.ir.BatchResult;

/**
 * What the scheduler emits at each batch boundary: the batch that just finished and the state it left
 * behind (including the size chosen for the next batch).
 */
public record BatchReport(
    BatchResult result,
    BatchProcessorState.Snapshot state
) {}
