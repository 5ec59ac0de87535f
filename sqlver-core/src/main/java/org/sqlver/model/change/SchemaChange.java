package org.sqlver.model.change;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.model.Order;
import org.sqlver.model.SchemaObjectType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A simple change that needs no explicit SQL. Remove and rename changes name the previous object
 * through {@code previousName}; the other kinds must not.
 */
@Getter
public final class SchemaChange implements Change {
    private final Order order;
    private final String comment;
    private final SchemaObjectType objectType;
    private final ChangeType changeType;
    private final String previousName;
    private final List<String> affects;

    @Builder
    private SchemaChange(Order order, String comment, SchemaObjectType objectType,
                         ChangeType changeType, String previousName,
                         @Singular("affect") List<String> affects) {
        this.order = Objects.requireNonNull(order, "order must not be null");
        this.comment = comment;
        this.objectType = Objects.requireNonNull(objectType, "objectType must not be null");
        this.changeType = Objects.requireNonNull(changeType, "changeType must not be null");
        if (changeType == ChangeType.SQL) {
            throw new IllegalArgumentException("sql changes must be SqlChange instances");
        }
        if (changeType.requiresPreviousName() && (previousName == null || previousName.isBlank())) {
            throw new IllegalArgumentException(changeType.displayName() + " change requires a previous name");
        }
        if (!changeType.requiresPreviousName() && previousName != null) {
            throw new IllegalArgumentException(changeType.displayName() + " change must not have a previous name");
        }
        this.previousName = previousName;

        List<String> aff = new ArrayList<>(affects == null ? List.of() : affects);
        if (previousName != null && !aff.contains(previousName)) {
            aff.add(previousName);
        }
        this.affects = List.copyOf(aff);
    }

    public static SchemaChange of(Order order, SchemaObjectType objectType, ChangeType changeType, String previousName) {
        return builder().order(order).objectType(objectType).changeType(changeType).previousName(previousName).build();
    }

    @Override
    public String toString() {
        return changeType.displayName() + " " + objectType.displayName()
                + (previousName == null ? "" : " '" + previousName + "'") + " @" + order;
    }
}
