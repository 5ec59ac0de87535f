package org.sqlver.loader;

import lombok.Getter;
import org.sqlver.version.SchemaPackage;
import org.sqlver.version.SchemaProblem;

import java.util.List;

/**
 * A package read from disk, with the problems found in its directory layout. Problems inside the
 * schema files are reported by each version once it is loaded.
 */
@Getter
public class LoadedPackage {
    private final SchemaPackage schemaPackage;
    private final List<SchemaProblem> problems;

    public LoadedPackage(SchemaPackage schemaPackage, List<SchemaProblem> problems) {
        this.schemaPackage = schemaPackage;
        this.problems = List.copyOf(problems);
    }

    public boolean hasBlockingProblems() {
        return problems.stream().anyMatch(p -> p.getLevel().isBlocking());
    }
}
