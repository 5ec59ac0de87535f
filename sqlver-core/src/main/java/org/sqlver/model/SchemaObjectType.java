package org.sqlver.model;

import java.util.Locale;

/**
 * Kind of a schema object. Closed set: every kind has its own upgrade analysis.
 */
public enum SchemaObjectType {
    TABLE,
    VIEW,
    COLUMN,
    CONSTRAINT;

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a schema type written in a schema file ({@code "Table"}, {@code "column"}, ...).
     *
     * @throws IllegalArgumentException for an unknown type
     */
    public static SchemaObjectType fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("schema type must not be blank");
        }
        String key = raw.trim().toUpperCase(Locale.ROOT);
        for (SchemaObjectType t : values()) {
            if (t.name().equals(key)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown schema type '" + raw + "'");
    }
}
