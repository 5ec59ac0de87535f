package org.sqlver.version;

import lombok.Builder;
import lombok.Getter;

import java.util.Objects;

/**
 * A parse or definition problem found while reading one schema version.
 */
@Getter
public final class SchemaProblem {
    private final ProblemLevel level;
    private final String message;
    private final String sourceName;
    private final String sourcePosition;

    @Builder
    private SchemaProblem(ProblemLevel level, String message, String sourceName,
                          String sourcePosition, Integer sourceLine, Integer sourceColumn) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.sourceName = Objects.requireNonNull(sourceName, "sourceName must not be null");
        if (sourcePosition != null && !sourcePosition.isEmpty()) {
            if (sourceLine != null || sourceColumn != null) {
                throw new IllegalArgumentException("give either a source position or a line/column, not both");
            }
            this.sourcePosition = sourcePosition;
        } else if (sourceLine != null) {
            this.sourcePosition = "line " + sourceLine + (sourceColumn == null ? "" : ", column " + sourceColumn);
        } else {
            this.sourcePosition = null;
        }
    }

    public static SchemaProblem of(ProblemLevel level, String sourceName, String message) {
        return builder().level(level).sourceName(sourceName).message(message).build();
    }

    /** {@code file} or {@code file @ position}. */
    public String getSourceLocation() {
        return sourcePosition == null ? sourceName : sourceName + " @ " + sourcePosition;
    }

    @Override
    public String toString() {
        return level + ": " + message + " ; " + getSourceLocation();
    }
}
