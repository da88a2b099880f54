package org.stylegovernance.replacement.ir;

/**
 * Broad class of a per-element failure, derived from its message.
 */
public enum FailureCategory {
    /** Temporary host trouble; likely to succeed if tried again later. */
    TRANSIENT,
    /** Will not resolve by retrying (permissions, unknown causes). */
    PERSISTENT,
    /** The request referred to something that does not exist or is not acceptable. */
    VALIDATION,
    /** The individual element cannot take the assignment (locked, wrong type). */
    PARTIAL
}
