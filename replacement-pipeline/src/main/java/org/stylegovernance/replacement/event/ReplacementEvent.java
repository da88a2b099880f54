package org.stylegovernance.replacement.event;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.stylegovernance.replacement.ir.ErrorKind;
import org.stylegovernance.replacement.ir.FailedElement;
import org.stylegovernance.replacement.ir.OperationKind;
import org.stylegovernance.replacement.ir.ReplacementProgress;

/**
 * Events emitted while a replacement runs, in the order a presentation layer should apply them.
 */
public interface ReplacementEvent {

    /** Message type as seen on the wire, e.g. {@code operation-started}. */
    String type();

    record OperationStarted(
        OperationKind operationType,
        String sourceId,
        String targetId,
        int affectedCount
    ) implements ReplacementEvent {
        @Override
        public String type() {
            return "operation-started";
        }
    }

    record CheckpointCreated(
        String title,
        Instant timestamp
    ) implements ReplacementEvent {
        @Override
        public String type() {
            return "checkpoint-created";
        }
    }

    record Progress(
        ReplacementProgress progress
    ) implements ReplacementEvent {
        @Override
        public String type() {
            return "progress";
        }
    }

    /** {@code failedElements} is empty when everything was updated. */
    record OperationComplete(
        OperationKind operationType,
        int updatedCount,
        List<FailedElement> failedElements,
        Duration duration,
        boolean hasWarnings
    ) implements ReplacementEvent {
        @Override
        public String type() {
            return "operation-complete";
        }
    }

    /** {@code checkpointTitle} is null when the failure happened before a checkpoint existed. */
    record OperationError(
        OperationKind operationType,
        String error,
        ErrorKind errorType,
        String checkpointTitle
    ) implements ReplacementEvent {
        @Override
        public String type() {
            return "operation-error";
        }

        public boolean canRollback() {
            return checkpointTitle != null;
        }
    }
}
