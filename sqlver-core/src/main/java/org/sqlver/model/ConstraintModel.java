package org.sqlver.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.sqlver.model.change.Change;
import org.sqlver.model.sql.SqlSet;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A limitation on a table, view or column. Constraints may be enforced by SQL or by code; the
 * {@code details} map holds the loosely defined extras (foreign key target, messages, ...).
 */
@Getter
public final class ConstraintModel implements SchemaObject {

    /** Recognized constraint types, normalized with {@link #normalizeType(String)}. */
    public static final Set<String> CONSTRAINT_TYPES = Set.of(
            "key", "primarykey", "fulltextkey", "uniquekey", "spatialkey", "foreignkey",
            "uniqueindex", "index", "primaryindex", "fulltextindex", "spatialindex",
            "codeindex", "codeforeignkey",
            "initialvalue", "noupdate", "notread",
            "constantquery", "constantupdate", "updatevalue",
            "restrictquery", "notnull", "nullable",
            "validatewrite", "validate",
            "valuerestriction", "createrestriction", "updaterestriction",
            "updaterequired", "requiredupdate",
            "removed"
    );

    private final Order order;
    private final String comment;
    private final String constraintType;
    private final String name;
    private final List<String> columnNames;
    private final Map<String, Object> details;
    private final SqlSet sql;
    private final List<Change> changes;

    @Builder
    private ConstraintModel(Order order, String comment, String constraintType, String name,
                            @Singular List<String> columnNames,
                            @Singular Map<String, Object> details,
                            SqlSet sql,
                            @Singular List<Change> changes) {
        this.order = Objects.requireNonNull(order, "order must not be null");
        String type = normalizeType(Objects.requireNonNull(constraintType, "constraintType must not be null"));
        if (!CONSTRAINT_TYPES.contains(type)) {
            throw new IllegalArgumentException("invalid constraint type '" + constraintType + "'");
        }
        this.comment = comment;
        this.constraintType = type;
        this.name = name;
        this.columnNames = List.copyOf(columnNames);
        this.details = Map.copyOf(details);
        this.sql = sql;
        this.changes = List.copyOf(changes);
    }

    /**
     * {@code "Primary Key"}, {@code "primary_key"} and {@code "primary-key"} all become
     * {@code "primarykey"}.
     */
    public static String normalizeType(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (c != ' ' && c != '\r' && c != '\n' && c != '\t' && c != '_' && c != '-') {
                sb.append(Character.toLowerCase(c));
            }
        }
        return sb.toString();
    }

    /**
     * The explicit name if given, else {@code type(col1,col2)}.
     */
    @Override
    public String getFullName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return constraintType + "(" + String.join(",", columnNames) + ")";
    }

    @Override
    public String getName() {
        return name != null ? name : constraintType;
    }

    @Override
    public SchemaObjectType getObjectType() {
        return SchemaObjectType.CONSTRAINT;
    }

    @Override
    public List<ConstraintModel> getConstraints() {
        return List.of();
    }

    @Override
    public List<? extends SchemaObject> getSubSchema() {
        return List.of();
    }

    @Override
    public String toString() {
        return "Constraint(" + getFullName() + ")";
    }
}
