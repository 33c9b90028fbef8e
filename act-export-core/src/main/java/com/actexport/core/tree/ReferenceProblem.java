package com.actexport.core.tree;

/**
 * A cross-reference that does not point at a valid item.
 *
 * @param reference the offending item number
 * @param kind what is wrong with it
 * @param message human-readable description
 */
public record ReferenceProblem(
    String reference,
    Kind kind,
    String message
) {
    /**
     * Problem categories.
     */
    public enum Kind {
        /** The reference lies outside the branch it is allowed to point into. */
        OUTSIDE_BRANCH,
        /** No item carries the referenced number. */
        MISSING
    }
}
