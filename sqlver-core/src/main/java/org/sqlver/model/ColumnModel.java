package org.sqlver.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.model.change.Change;

import java.util.List;
import java.util.Objects;

/**
 * A column definition. Its constraints are its sub-schema.
 */
@Getter
public final class ColumnModel implements SchemaObject {
    private final Order order;
    private final String comment;
    private final String name;
    private final String valueType;
    private final String dataType;
    private final boolean autoIncrement;
    private final String defaultValue;
    private final String beforeColumn;
    private final String afterColumn;
    private final List<ConstraintModel> constraints;
    private final List<Change> changes;

    @Builder
    private ColumnModel(Order order, String comment, String name, String valueType, String dataType,
                        boolean autoIncrement, String defaultValue, String beforeColumn, String afterColumn,
                        @Singular List<ConstraintModel> constraints,
                        @Singular List<Change> changes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("column name must not be blank");
        }
        this.order = Objects.requireNonNull(order, "order must not be null");
        this.comment = comment;
        this.name = name;
        this.valueType = valueType;
        this.dataType = dataType == null ? valueType : dataType;
        this.autoIncrement = autoIncrement;
        this.defaultValue = defaultValue;
        this.beforeColumn = beforeColumn;
        this.afterColumn = afterColumn;
        this.constraints = List.copyOf(constraints);
        this.changes = List.copyOf(changes);
    }

    @Override
    public String getFullName() {
        return name;
    }

    @Override
    public SchemaObjectType getObjectType() {
        return SchemaObjectType.COLUMN;
    }

    @Override
    public List<ConstraintModel> getSubSchema() {
        return constraints;
    }

    @Override
    public String toString() {
        return "Column(" + name + ")";
    }
}
