package org.stylegovernance.replacement.ir;

import java.util.List;

/**
 * Operator request to swap one assignment for another on every listed element. The element ids come
 * from the audit that detected the source assignment.
 */
public record ReplacementRequest(
    OperationKind kind,
    String sourceId,
    String targetId,
    List<String> affectedElementIds
) {
    public int affectedCount() {
        return affectedElementIds != null ? affectedElementIds.size() : 0;
    }
}
