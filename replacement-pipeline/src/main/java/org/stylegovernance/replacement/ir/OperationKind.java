package org.stylegovernance.replacement.ir;

/**
 * What kind of design-system assignment a replacement rewrites.
 */
public enum OperationKind {
    STYLE("style", "Style Replacement"),
    TOKEN("token", "Token Replacement");

    private final String wireName;
    private final String checkpointLabel;

    OperationKind(String wireName, String checkpointLabel) {
        this.wireName = wireName;
        this.checkpointLabel = checkpointLabel;
    }

    public String wireName() {
        return wireName;
    }

    /** Prefix used for the version checkpoint taken before this kind of operation. */
    public String checkpointLabel() {
        return checkpointLabel;
    }
}
