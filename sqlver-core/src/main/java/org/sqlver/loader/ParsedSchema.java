package org.sqlver.loader;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.model.SchemaObject;
import org.sqlver.model.change.Change;
import org.sqlver.version.SchemaProblem;

import java.util.List;

/**
 * Everything read from one schema file.
 */
@Getter
@Builder
public class ParsedSchema {
    @Singular
    private final List<Change> topChanges;
    @Singular("schemaObject")
    private final List<SchemaObject> schema;
    @Singular
    private final List<SchemaProblem> problems;
}
