package org.stylegovernance.replacement.ir;

import java.time.Duration;
import java.util.List;

import lombok.Builder;

/**
 * Terminal summary of a replacement. Built once when the operation settles and never changed afterwards.
 *
 * <p>{@code errorKind} is null when the operation completed (possibly with warnings). {@code checkpointTitle}
 * is null only when the operation failed before a checkpoint existed, in which case the document was never
 * touched.
 */
@Builder
public record ReplacementResult(
    OperationKind operationKind,
    boolean success,
    int updatedCount,
    int failedCount,
    List<FailedElement> failedElements,
    String checkpointTitle,
    Duration duration,
    boolean hasWarnings,
    ErrorKind errorKind,
    String errorMessage,
    FailureSummary failureSummary
) {
    public ReplacementResult {
        failedElements = failedElements != null ? List.copyOf(failedElements) : List.of();
        failureSummary = failureSummary != null ? failureSummary : FailureSummary.EMPTY;
        duration = duration != null ? duration : Duration.ZERO;
    }

    public boolean isError() {
        return errorKind != null;
    }

    /** A manual rollback is possible whenever a checkpoint was taken. */
    public boolean canRollback() {
        return checkpointTitle != null;
    }
}
