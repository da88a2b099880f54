package org.stylegovernance.replacement.progress;

import org.stylegovernance.replacement.batch.BatchProcessorState;
import org.stylegovernance.replacement.ir.ReplacementProgress;

/**
 * Projects scheduler state into progress telemetry. Called once per batch boundary, never per element.
 */
public final class ProgressReporter {

    private ProgressReporter() {}

    public static ReplacementProgress project(BatchProcessorState.Snapshot state) {
        return new ReplacementProgress(
            percent(state.processed(), state.total()),
            state.batchesCompleted(),
            estimateTotalBatches(state),
            state.lastBatchSize(),
            state.processed(),
            state.failed()
        );
    }

    /** {@code floor(processed / total * 100)}; an empty operation counts as done. */
    static int percent(int processed, int total) {
        if (total <= 0) {
            return 100;
        }
        return (int) ((long) processed * 100 / total);
    }

    /** Batches already run plus what the remainder needs at the size chosen for the next batch. */
    static int estimateTotalBatches(BatchProcessorState.Snapshot state) {
        var remaining = state.remaining();
        var nextSize = Math.max(1, state.currentBatchSize());
        return state.batchesCompleted() + (remaining + nextSize - 1) / nextSize;
    }
}
