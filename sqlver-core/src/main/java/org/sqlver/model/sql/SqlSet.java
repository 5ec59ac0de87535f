package org.sqlver.model.sql;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The variants of one SQL snippet for the different platforms.
 */
@Getter
@EqualsAndHashCode
public final class SqlSet {
    private final List<SqlString> statements;

    public SqlSet(List<SqlString> statements) {
        if (statements == null || statements.isEmpty()) {
            throw new IllegalArgumentException("sql set must contain at least one statement");
        }
        this.statements = List.copyOf(statements);
    }

    public static SqlSet of(SqlString... statements) {
        return new SqlSet(List.of(statements));
    }

    /**
     * Picks the most appropriate statement. Platforms are tried in the given order; when none of
     * them matches, the first universal statement is used.
     */
    public Optional<SqlString> forPlatform(String... platforms) {
        for (String plat : platforms) {
            String p = plat.trim().toLowerCase(Locale.ROOT);
            for (SqlString s : statements) {
                if (s.getPlatforms().contains(p)) {
                    return Optional.of(s);
                }
            }
        }
        return statements.stream().filter(SqlString::isUniversal).findFirst();
    }

    @Override
    public String toString() {
        return "SqlSet" + statements;
    }
}
