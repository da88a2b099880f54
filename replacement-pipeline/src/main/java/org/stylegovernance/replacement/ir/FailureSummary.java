package org.stylegovernance.replacement.ir;

import java.util.List;
import java.util.Map;

/**
 * Failures of one operation grouped by category, with the distinct messages in the order they were
 * first seen.
 */
public record FailureSummary(
    Map<FailureCategory, Integer> countsByCategory,
    int total,
    List<String> messages
) {
    public static final FailureSummary EMPTY = new FailureSummary(Map.of(), 0, List.of());

    public int count(FailureCategory category) {
        return countsByCategory.getOrDefault(category, 0);
    }
}
