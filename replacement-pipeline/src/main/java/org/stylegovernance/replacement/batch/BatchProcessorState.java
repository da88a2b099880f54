package org.stylegovernance.replacement.batch;

import java.util.List;

import org.stylegovernance.replacement.ir.FailedElement;
import org.stylegovernance.replacement.ledger.FailureLedger;

/**
 * Progress cursor of one scheduler run. Owned by a single operation and only touched at batch
 * boundaries, so it needs no locking beyond what the ledger does.
 *
 * <p>Invariants: {@code processed + remaining == total}, and {@code minBatchSize <= currentBatchSize <=
 * maxBatchSize}.
 */
public class BatchProcessorState {

    /** Immutable copy of the state taken at a batch boundary. */
    public record Snapshot(
        int currentBatchSize,
        int consecutiveSuccesses,
        int processed,
        int total,
        int failed,
        int batchesCompleted,
        int lastBatchSize
    ) {
        public int remaining() {
            return total - processed;
        }
    }

    private final List<String> elementIds;
    private final FailureLedger ledger;
    private final int minBatchSize;
    private final int maxBatchSize;

    private int currentBatchSize;
    private int consecutiveSuccesses;
    private int processed;
    private int batchesCompleted;
    private int lastBatchSize;

    BatchProcessorState(List<String> elementIds, FailureLedger ledger, int initialBatchSize, int minBatchSize,
                        int maxBatchSize) {
        this.elementIds = List.copyOf(elementIds);
        this.ledger = ledger;
        this.minBatchSize = minBatchSize;
        this.maxBatchSize = maxBatchSize;
        this.currentBatchSize = initialBatchSize;
        checkInvariants();
    }

    public int getCurrentBatchSize() {
        return currentBatchSize;
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses;
    }

    public int getProcessed() {
        return processed;
    }

    public int getTotal() {
        return elementIds.size();
    }

    public int getRemaining() {
        return elementIds.size() - processed;
    }

    public boolean hasRemaining() {
        return getRemaining() > 0;
    }

    public List<FailedElement> getFailures() {
        return ledger.failures();
    }

    /** The next contiguous run of ids, at most {@code currentBatchSize} long. */
    List<String> nextBatch() {
        var end = Math.min(processed + currentBatchSize, elementIds.size());
        return elementIds.subList(processed, end);
    }

    void recordUpdated() {
        ledger.recordUpdated();
    }

    void completeBatch(int batchSize, List<FailedElement> batchFailures) {
        if (batchSize > getRemaining()) {
            throw new IllegalStateException("Batch of " + batchSize + " exceeds the " + getRemaining()
                + " elements left");
        }
        ledger.recordAll(batchFailures);
        processed += batchSize;
        batchesCompleted++;
        lastBatchSize = batchSize;
        checkInvariants();
    }

    void resize(int newBatchSize) {
        currentBatchSize = newBatchSize;
        checkInvariants();
    }

    void incrementConsecutiveSuccesses() {
        consecutiveSuccesses++;
    }

    void resetConsecutiveSuccesses() {
        consecutiveSuccesses = 0;
    }

    public Snapshot snapshot() {
        return new Snapshot(currentBatchSize, consecutiveSuccesses, processed, getTotal(), ledger.failedCount(),
            batchesCompleted, lastBatchSize);
    }

    private void checkInvariants() {
        if (currentBatchSize < minBatchSize || currentBatchSize > maxBatchSize) {
            throw new IllegalStateException("Batch size " + currentBatchSize + " outside [" + minBatchSize
                + ", " + maxBatchSize + "]");
        }
        if (processed < 0 || processed > elementIds.size()) {
            throw new IllegalStateException("Processed count " + processed + " outside [0, "
                + elementIds.size() + "]");
        }
    }
}
