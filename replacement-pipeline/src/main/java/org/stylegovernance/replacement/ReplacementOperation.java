package org.stylegovernance.replacement;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.stylegovernance.replacement.ir.Checkpoint;
import org.stylegovernance.replacement.ir.OperationKind;
import org.stylegovernance.replacement.ir.ReplacementRequest;
import org.stylegovernance.replacement.ir.ReplacementResult;
import org.stylegovernance.replacement.ledger.FailureLedger;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * One in-flight bulk edit. Owned by the engine running it; the affected ids are captured when the
 * operation starts and never change afterwards, even if the document does.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
@ToString(of = {"kind", "sourceId", "targetId", "startedAt"})
public class ReplacementOperation {
    private final OperationKind kind;
    private final String sourceId;
    private final String targetId;
    private final List<String> affectedElementIds;
    private final Instant startedAt;

    private volatile Checkpoint checkpoint;
    private volatile FailureLedger ledger;
    private volatile ReplacementResult result;
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private volatile boolean cancelRequested;

    ReplacementOperation(ReplacementRequest request, Instant startedAt) {
        this.kind = request.kind();
        this.sourceId = request.sourceId();
        this.targetId = request.targetId();
        this.affectedElementIds = request.affectedElementIds() == null
            ? List.of()
            : Collections.unmodifiableList(new ArrayList<>(request.affectedElementIds()));
        this.startedAt = startedAt;
    }

    public String getCheckpointTitle() {
        return checkpoint != null ? checkpoint.title() : null;
    }

    /** True once the terminal result exists; nothing may settle the operation a second time. */
    boolean isSettled() {
        return result != null;
    }

    boolean isCancelRequested() {
        return cancelRequested;
    }

    void requestCancel() {
        cancelRequested = true;
    }
}
