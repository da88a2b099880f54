package org.stylegovernance.replacement.ledger;

import java.time.Duration;
import java.util.List;

import org.stylegovernance.replacement.ir.ErrorKind;
import org.stylegovernance.replacement.ir.FailedElement;
import org.stylegovernance.replacement.ir.FailureCategory;
import org.stylegovernance.replacement.ir.FailureSummary;
import org.stylegovernance.replacement.ir.OperationKind;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FailureLedgerTest {

    private static final String TITLE = "Style Replacement - 2024-05-01 13:45:10";

    private static FailedElement failed(String id, String reason) {
        return new FailedElement(id, "Text " + id, reason, 3);
    }

    @Test
    void cleanRunSettlesAsSuccess() {
        var result = new FailureLedger(10).settle(OperationKind.STYLE, TITLE, Duration.ofMillis(250));

        assertTrue(result.success());
        assertFalse(result.isError());
        assertFalse(result.hasWarnings());
        assertEquals(10, result.updatedCount());
        assertEquals(0, result.failedCount());
        assertEquals(Duration.ofMillis(250), result.duration());
        assertSame(FailureSummary.EMPTY, result.failureSummary());
    }

    @Test
    void partialFailureSettlesWithWarnings() {
        var ledger = new FailureLedger(10);
        ledger.record(failed("el-1", "Element is locked"));
        ledger.record(failed("el-2", "Request timeout"));

        var result = ledger.settle(OperationKind.STYLE, TITLE, Duration.ZERO);

        assertFalse(result.success());
        assertFalse(result.isError());
        assertTrue(result.hasWarnings());
        assertEquals(8, result.updatedCount());
        assertEquals(2, result.failedCount());
        assertEquals(1, result.failureSummary().count(FailureCategory.PARTIAL));
        assertEquals(1, result.failureSummary().count(FailureCategory.TRANSIENT));
        assertEquals(List.of("el-1", "el-2"),
            result.failedElements().stream().map(FailedElement::elementId).toList());
    }

    @Test
    void totalFailureSettlesAsProcessingError() {
        var ledger = new FailureLedger(2);
        ledger.recordAll(List.of(failed("el-1", "Element is locked"), failed("el-2", "Permission denied")));

        var result = ledger.settle(OperationKind.TOKEN, TITLE, Duration.ZERO);

        assertTrue(ledger.isTotalFailure());
        assertEquals(ErrorKind.PROCESSING, result.errorKind());
        assertEquals("All 2 elements failed to update (Element is locked). Restore checkpoint '" + TITLE
            + "' to undo any partial changes.", result.errorMessage());
        assertFalse(result.hasWarnings());
        assertTrue(result.canRollback());
    }

    @Test
    void totalPermissionFailureSettlesAsPermissionError() {
        var ledger = new FailureLedger(2);
        ledger.recordAll(List.of(failed("el-1", "Permission denied"), failed("el-2", "403 Forbidden")));

        assertTrue(ledger.allPermissionFailures());
        assertEquals(ErrorKind.PERMISSION, ledger.settle(OperationKind.STYLE, TITLE, Duration.ZERO).errorKind());
    }

    @Test
    void refusesMoreOutcomesThanElements() {
        var ledger = new FailureLedger(2);
        ledger.recordUpdated();
        ledger.record(failed("el-1", "boom"));

        assertThrows(IllegalStateException.class, () -> ledger.record(failed("el-2", "boom")));
        assertThrows(IllegalStateException.class, ledger::recordUpdated);
        assertEquals(1, ledger.updatedCount());
        assertEquals(1, ledger.failedCount());
    }

    @Test
    void abortedRunCountsElementsUpdatedMidBatch() {
        var ledger = new FailureLedger(150);
        for (int i = 0; i < 119; i++) {
            ledger.recordUpdated();
        }
        ledger.record(failed("el-3", "Element is locked"));

        var result = ledger.settleAborted(OperationKind.STYLE, TITLE, Duration.ZERO, ErrorKind.PROCESSING,
            "Replacement aborted");

        assertFalse(result.success());
        assertEquals(119, result.updatedCount());
        assertEquals(1, result.failedCount());
        assertEquals(ErrorKind.PROCESSING, result.errorKind());
        assertEquals("Replacement aborted", result.errorMessage());
        assertFalse(result.hasWarnings());
    }

    @Test
    void abortedRunBeforeProcessingReportsNothingDone() {
        var result = new FailureLedger(10).settleAborted(OperationKind.TOKEN, null, Duration.ZERO,
            ErrorKind.CHECKPOINT, "Checkpoint creation failed");

        assertEquals(0, result.updatedCount());
        assertEquals(0, result.failedCount());
        assertFalse(result.canRollback());
    }

    @Test
    void failuresViewIsACopy() {
        var ledger = new FailureLedger(3);
        var view = ledger.failures();
        ledger.record(failed("el-1", "boom"));

        assertTrue(view.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> ledger.failures().clear());
    }
}
