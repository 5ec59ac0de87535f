package org.sqlver.upgrade.model;

import org.sqlver.version.ProblemLevel;
import org.sqlver.version.SchemaProblem;
import org.sqlver.version.SchemaVersionNumber;

import java.util.Objects;

/**
 * A problem surfaced by a branch analysis, tagged with the version it was found in.
 */
public record ReportedProblem(ProblemLevel level, SchemaVersionNumber version, String text) {

    public ReportedProblem {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static ReportedProblem of(SchemaVersionNumber version, SchemaProblem problem) {
        return new ReportedProblem(problem.getLevel(), version,
                problem.getMessage() + " ; " + problem.getSourceLocation());
    }

    public static ReportedProblem of(ProblemLevel level, SchemaVersionNumber version, UpgradeAnalysisProblem problem) {
        return new ReportedProblem(level, version, problem.toString());
    }

    public boolean isBlocking() {
        return level.isBlocking();
    }

    @Override
    public String toString() {
        return "(" + version + ") " + level + " " + text;
    }
}
