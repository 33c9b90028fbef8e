package com.actexport.core.tree;

/**
 * A consistency problem found in an act snapshot.
 *
 * @param severity how serious the problem is
 * @param location where it was found, such as a node id or {@code table t1 [0,1]}
 * @param message description
 */
public record DataProblem(
    Severity severity,
    String location,
    String message
) {
    /**
     * Problem severity.
     */
    public enum Severity {
        /** Output is still produced but parts of it are skipped or degraded. */
        ERROR,
        /** Output is unaffected; the snapshot is ambiguous. */
        WARNING
    }

    public static DataProblem error(String location, String message) {
        return new DataProblem(Severity.ERROR, location, message);
    }

    public static DataProblem warning(String location, String message) {
        return new DataProblem(Severity.WARNING, location, message);
    }

    @Override
    public String toString() {
        return severity + " " + location + ": " + message;
    }
}
