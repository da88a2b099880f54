package org.stylegovernance.replacement.ir;

/**
 * Progress cursor emitted after each batch. Tracks how far the operation has got and what the
 * scheduler expects still to do.
 */
public record ReplacementProgress(
    int percent,
    int currentBatch,
    int totalBatchesEstimate,
    int currentBatchSize,
    int processed,
    int failedSoFar
) {}
