package org.stylegovernance.replacement.checkpoint;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

import org.stylegovernance.replacement.ir.OperationKind;

/**
 * Builds checkpoint titles such as {@code "Style Replacement - 2024-05-01 13:45:10"}.
 */
public final class CheckpointTitles {

    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private CheckpointTitles() {}

    public static String titleFor(OperationKind kind, Clock clock) {
        return kind.checkpointLabel() + " - " + TIMESTAMP_FORMAT.format(clock.instant());
    }
}
