package org.sqlver.upgrade.model;

import java.util.Objects;

/**
 * A problem found in the upgrade definition of an object. Informational: the analysis keeps going.
 *
 * @param subject the object or change the problem is about
 * @param message what is wrong
 */
public record UpgradeAnalysisProblem(Object subject, String message) {

    public UpgradeAnalysisProblem {
        Objects.requireNonNull(message, "message must not be null");
    }

    @Override
    public String toString() {
        return message + ": " + subject;
    }
}
