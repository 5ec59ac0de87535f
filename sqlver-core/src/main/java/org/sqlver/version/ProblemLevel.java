package org.sqlver.version;

/**
 * Severity of a reported problem.
 */
public enum ProblemLevel {
    /** The input could not be understood; the element was dropped. */
    FATAL,
    /** Authoring mistake; blocks generation. */
    ERROR,
    /** Author omission; safe to proceed. */
    WARNING,
    NOTE;

    public boolean isBlocking() {
        return this == FATAL || this == ERROR;
    }
}
