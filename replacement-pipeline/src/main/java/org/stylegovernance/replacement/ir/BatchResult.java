package org.stylegovernance.replacement.ir;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one batch, reported at the batch boundary.
 */
public record BatchResult(
    int batchNumber,
    int batchSize,
    int updated,
    int failed,
    List<FailedElement> failures,
    Duration duration
) {
    public boolean hasFailures() {
        return failed > 0;
    }
}
