package org.sqlver.model;

import org.sqlver.model.change.Change;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A named, versioned unit of a schema. The variant set is closed: tables and views
 * ({@link ColumnarSchemaObject}), columns and constraints.
 */
public sealed interface SchemaObject extends Ordered
        permits ColumnarSchemaObject, ColumnModel, ConstraintModel {

    /** Simple name of the object. */
    String getName();

    /** Full, unique name; the key objects are matched on across versions. */
    String getFullName();

    String getComment();

    SchemaObjectType getObjectType();

    /**
     * Changes to apply to upgrade the object from the previous version. Empty when nothing changed
     * or when the object is new.
     */
    List<Change> getChanges();

    List<ConstraintModel> getConstraints();

    /** Nested objects that may carry their own changes. */
    List<? extends SchemaObject> getSubSchema();

    /**
     * Looks recursively into the sub-schema for any authored change.
     */
    default boolean hasAnyChanges() {
        if (!getChanges().isEmpty()) {
            return true;
        }
        for (SchemaObject sub : getSubSchema()) {
            if (sub.hasAnyChanges()) {
                return true;
            }
        }
        return false;
    }

    static String createFullName(String... parts) {
        return Stream.of(parts)
                .map(p -> p == null ? "" : p)
                .collect(Collectors.joining("."));
    }
}
