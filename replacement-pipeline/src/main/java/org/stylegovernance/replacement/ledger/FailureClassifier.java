package org.stylegovernance.replacement.ledger;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.stylegovernance.replacement.ir.FailedElement;
import org.stylegovernance.replacement.ir.FailureCategory;
import org.stylegovernance.replacement.ir.FailureSummary;

/**
 * Sorts failure messages into {@link FailureCategory categories} and turns them into messages an operator
 * can act on. Anything unrecognised is treated as persistent.
 */
public final class FailureClassifier {

    private static final List<String> TRANSIENT_MARKERS = List.of("timeout", "429", "503", "network", "connection");
    private static final List<String> VALIDATION_MARKERS =
        List.of("invalid", "not found", "does not exist", "cannot be the same");
    private static final List<String> PARTIAL_MARKERS = List.of("locked", "read-only", "not a text");
    private static final List<String> PERMISSION_MARKERS =
        List.of("permission", "access denied", "unauthorized", "forbidden");

    private FailureClassifier() {}

    public static FailureCategory classify(String message) {
        var normalized = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (containsAny(normalized, TRANSIENT_MARKERS)) {
            return FailureCategory.TRANSIENT;
        }
        if (containsAny(normalized, VALIDATION_MARKERS)) {
            return FailureCategory.VALIDATION;
        }
        if (containsAny(normalized, PARTIAL_MARKERS)) {
            return FailureCategory.PARTIAL;
        }
        return FailureCategory.PERSISTENT;
    }

    /** True for failures caused by missing rights on the document rather than by the element itself. */
    public static boolean isPermissionFailure(String message) {
        if (message == null) {
            return false;
        }
        var normalized = message.toLowerCase(Locale.ROOT);
        return classify(message) == FailureCategory.PERSISTENT && containsAny(normalized, PERMISSION_MARKERS);
    }

    public static String describe(Throwable failure, String context) {
        return describe(failure.getMessage(), context);
    }

    public static String describe(String message, String context) {
        var prefix = context == null || context.isEmpty() ? "" : context + ": ";
        switch (classify(message)) {
            case TRANSIENT:
                return prefix + "Temporary issue (" + message + "). Please try again.";
            case VALIDATION:
                return prefix + "Invalid input (" + message + "). Please verify your selection.";
            case PARTIAL:
                return prefix + "Some items could not be processed (" + message + ").";
            case PERSISTENT:
            default:
                return prefix + "Operation cannot complete (" + message + "). Please check permissions and settings.";
        }
    }

    public static FailureSummary summarize(List<FailedElement> failures) {
        if (failures.isEmpty()) {
            return FailureSummary.EMPTY;
        }
        Map<FailureCategory, Integer> counts = new EnumMap<>(FailureCategory.class);
        var messages = new LinkedHashSet<String>();
        for (var failure : failures) {
            counts.merge(classify(failure.reason()), 1, Integer::sum);
            messages.add(failure.reason());
        }
        return new FailureSummary(Map.copyOf(counts), failures.size(), List.copyOf(messages));
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        return needles.stream().anyMatch(haystack::contains);
    }
}
