package org.sqlver.version;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.model.Ordered;
import org.sqlver.model.SchemaObject;
import org.sqlver.model.change.Change;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * One parsed version of a package: its schema, the top-level changes leading to it from the
 * previous version, and the problems found while parsing it.
 */
@Getter
public final class SchemaVersion {
    private final String packageName;
    private final SchemaVersionNumber version;
    private final List<Change> topChanges;
    private final List<SchemaObject> schema;
    private final List<SchemaProblem> problems;

    @Builder
    private SchemaVersion(String packageName, SchemaVersionNumber version,
                          @Singular List<Change> topChanges,
                          @Singular("schemaObject") List<SchemaObject> schema,
                          @Singular List<SchemaProblem> problems) {
        if (packageName == null || packageName.isBlank()) {
            throw new IllegalArgumentException("packageName must not be blank");
        }
        this.packageName = packageName;
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.topChanges = topChanges.stream().sorted(Comparator.comparing(Ordered::getOrder)).toList();
        this.schema = schema.stream().sorted(Comparator.comparing(Ordered::getOrder)).toList();
        this.problems = List.copyOf(problems);
    }

    public boolean hasBlockingProblems() {
        return problems.stream().anyMatch(p -> p.getLevel().isBlocking());
    }

    @Override
    public String toString() {
        return "SchemaVersion(" + packageName + " : " + version + ")";
    }
}
