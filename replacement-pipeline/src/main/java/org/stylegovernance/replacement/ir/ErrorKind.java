package org.stylegovernance.replacement.ir;

/**
 * Why an operation settled to the error state. The wire name is what the presentation layer sees
 * as {@code errorType}.
 */
public enum ErrorKind {
    VALIDATION("validation"),
    CHECKPOINT("checkpoint"),
    PROCESSING("processing"),
    PERMISSION("permission");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
