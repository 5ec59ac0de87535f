package org.sqlver.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.model.change.Change;

import java.util.List;
import java.util.Objects;

@Getter
public final class TableModel implements ColumnarSchemaObject {
    private final Order order;
    private final String comment;
    private final String catalogName;
    private final String schemaName;
    private final String name;
    private final String fullName;
    private final String tableSpace;
    private final List<ColumnModel> columns;
    private final List<ConstraintModel> constraints;
    private final List<Change> changes;

    @Builder
    private TableModel(Order order, String comment, String catalogName, String schemaName, String name,
                       String tableSpace,
                       @Singular List<ColumnModel> columns,
                       @Singular List<ConstraintModel> constraints,
                       @Singular List<Change> changes) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("table name must not be blank");
        }
        this.order = Objects.requireNonNull(order, "order must not be null");
        this.comment = comment;
        this.catalogName = catalogName;
        this.schemaName = schemaName;
        this.name = name;
        this.fullName = SchemaObject.createFullName(catalogName, schemaName, name);
        this.tableSpace = tableSpace;
        this.columns = List.copyOf(columns);
        this.constraints = List.copyOf(constraints);
        this.changes = List.copyOf(changes);
    }

    @Override
    public SchemaObjectType getObjectType() {
        return SchemaObjectType.TABLE;
    }

    @Override
    public String toString() {
        return "Table(" + fullName + ")";
    }
}
