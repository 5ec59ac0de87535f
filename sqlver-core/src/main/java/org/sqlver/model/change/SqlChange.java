package org.sqlver.model.change;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.model.Order;
import org.sqlver.model.SchemaObjectType;
import org.sqlver.model.sql.SqlSet;

import java.util.List;
import java.util.Objects;

/**
 * An explicit set of SQL instructions performing the change.
 */
@Getter
public final class SqlChange implements Change {
    private final Order order;
    private final String comment;
    private final SchemaObjectType objectType;
    private final SqlSet sqlSet;
    private final List<String> affects;

    @Builder
    private SqlChange(Order order, String comment, SchemaObjectType objectType, SqlSet sqlSet,
                      @Singular("affect") List<String> affects) {
        this.order = Objects.requireNonNull(order, "order must not be null");
        this.comment = comment;
        this.objectType = Objects.requireNonNull(objectType, "objectType must not be null");
        this.sqlSet = Objects.requireNonNull(sqlSet, "sqlSet must not be null");
        this.affects = affects == null ? List.of() : List.copyOf(affects);
    }

    @Override
    public ChangeType getChangeType() {
        return ChangeType.SQL;
    }

    @Override
    public String toString() {
        return "sql " + objectType.displayName() + " @" + order;
    }
}
