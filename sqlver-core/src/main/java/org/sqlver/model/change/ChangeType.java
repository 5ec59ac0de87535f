package org.sqlver.model.change;

import java.util.Locale;

public enum ChangeType {
    ADD,
    REMOVE,
    RENAME,
    ALTER,
    SQL;

    /** remove/rename 은 이전 이름이 있어야 대상 객체를 찾을 수 있다 */
    public boolean requiresPreviousName() {
        return this == REMOVE || this == RENAME;
    }

    public boolean isStructural() {
        return this == ADD || this == REMOVE || this == RENAME;
    }

    public String displayName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ChangeType fromName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("change type must not be blank");
        }
        String key = raw.trim().toUpperCase(Locale.ROOT);
        for (ChangeType t : values()) {
            if (t.name().equals(key)) {
                return t;
            }
        }
        throw new IllegalArgumentException("unknown change type '" + raw + "'");
    }
}
