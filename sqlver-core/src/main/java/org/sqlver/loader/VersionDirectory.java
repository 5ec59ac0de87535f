package org.sqlver.loader;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.version.SchemaProblem;
import org.sqlver.version.SchemaVersionNumber;

import java.nio.file.Path;
import java.util.List;

/**
 * One version directory of a package, as described by its name and its optional manifest.
 */
@Getter
@Builder
public class VersionDirectory {
    private final Path directory;
    private final SchemaVersionNumber version;

    /** True when the manifest names the parent, even as {@code null}. */
    private final boolean parentGiven;
    private final SchemaVersionNumber parent;

    @Singular
    private final List<SchemaProblem> problems;
}
