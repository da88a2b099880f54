package org.stylegovernance.replacement.ledger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import org.stylegovernance.replacement.ir.ErrorKind;
import org.stylegovernance.replacement.ir.FailedElement;
import org.stylegovernance.replacement.ir.OperationKind;
import org.stylegovernance.replacement.ir.ReplacementResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Append-only record of elements that could not be updated, a count of those that were, and the arithmetic
 * that turns both into the final {@link ReplacementResult}.
 */
@Slf4j
public class FailureLedger {
    private final int totalElements;
    private final List<FailedElement> failures = new ArrayList<>();
    private int updatedCount;

    public FailureLedger(int totalElements) {
        this.totalElements = totalElements;
    }

    /** One element was updated. Called as soon as its mutation succeeds, not at the batch boundary. */
    public synchronized void recordUpdated() {
        checkCapacity();
        updatedCount++;
    }

    public synchronized void record(FailedElement failure) {
        checkCapacity();
        log.atWarn().setMessage("Element {} ({}) failed after {} attempts: {}")
            .addArgument(failure::elementId)
            .addArgument(failure::elementName)
            .addArgument(failure::retryCount)
            .addArgument(failure::reason)
            .log();
        failures.add(failure);
    }

    public void recordAll(Collection<FailedElement> batchFailures) {
        batchFailures.forEach(this::record);
    }

    public synchronized int updatedCount() {
        return updatedCount;
    }

    public synchronized int failedCount() {
        return failures.size();
    }

    public synchronized List<FailedElement> failures() {
        return Collections.unmodifiableList(new ArrayList<>(failures));
    }

    public int totalElements() {
        return totalElements;
    }

    /** Every element failed; such an operation settles as an error even though it ran to the end. */
    public synchronized boolean isTotalFailure() {
        return totalElements > 0 && failures.size() == totalElements;
    }

    /** True when every recorded failure is a permission problem. */
    public synchronized boolean allPermissionFailures() {
        return !failures.isEmpty()
            && failures.stream().allMatch(f -> FailureClassifier.isPermissionFailure(f.reason()));
    }

    /**
     * Settle an operation that ran through every batch. A total failure settles as an error of kind
     * {@code permission} or {@code processing}; anything else completes, with warnings if some elements
     * failed.
     */
    public synchronized ReplacementResult settle(OperationKind kind, String checkpointTitle, Duration duration) {
        var failedCount = failures.size();
        var updated = totalElements - failedCount;
        var snapshot = List.copyOf(failures);
        var builder = ReplacementResult.builder()
            .operationKind(kind)
            .success(failedCount == 0)
            .updatedCount(updated)
            .failedCount(failedCount)
            .failedElements(snapshot)
            .checkpointTitle(checkpointTitle)
            .duration(duration)
            .hasWarnings(failedCount > 0 && updated > 0)
            .failureSummary(FailureClassifier.summarize(snapshot));
        if (isTotalFailure()) {
            var errorKind = allPermissionFailures() ? ErrorKind.PERMISSION : ErrorKind.PROCESSING;
            builder.errorKind(errorKind)
                .errorMessage("All " + totalElements + " elements failed to update ("
                    + snapshot.get(0).reason() + "). Restore checkpoint '" + checkpointTitle
                    + "' to undo any partial changes.");
        }
        return builder.build();
    }

    /**
     * Settle an operation that stopped early. Whatever was recorded so far is reported, including elements
     * of a batch that never reached its boundary; elements that never ran are counted neither as updated nor
     * as failed.
     */
    public synchronized ReplacementResult settleAborted(OperationKind kind,
                                                        String checkpointTitle,
                                                        Duration duration,
                                                        ErrorKind errorKind,
                                                        String errorMessage) {
        var snapshot = List.copyOf(failures);
        return ReplacementResult.builder()
            .operationKind(kind)
            .success(false)
            .updatedCount(updatedCount)
            .failedCount(snapshot.size())
            .failedElements(snapshot)
            .checkpointTitle(checkpointTitle)
            .duration(duration)
            .hasWarnings(false)
            .errorKind(errorKind)
            .errorMessage(errorMessage)
            .failureSummary(FailureClassifier.summarize(snapshot))
            .build();
    }

    private void checkCapacity() {
        if (updatedCount + failures.size() >= totalElements) {
            throw new IllegalStateException("More outcomes recorded than elements in the operation ("
                + totalElements + ")");
        }
    }
}
