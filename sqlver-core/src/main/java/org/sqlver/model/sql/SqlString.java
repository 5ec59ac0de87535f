package org.sqlver.model.sql;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.Locale;

/**
 * One SQL statement written for a syntax and a set of platforms.
 */
@Getter
@EqualsAndHashCode
public final class SqlString {
    public static final String UNIVERSAL = "universal";

    private final String sql;
    private final String syntax;
    private final List<String> platforms;

    public SqlString(String sql, String syntax, List<String> platforms) {
        if (sql == null || sql.isEmpty()) {
            throw new IllegalArgumentException("sql must not be empty");
        }
        if (syntax == null || syntax.isBlank()) {
            throw new IllegalArgumentException("syntax must not be blank");
        }
        if (platforms == null || platforms.isEmpty()) {
            throw new IllegalArgumentException("platforms must not be empty");
        }
        this.sql = sql;
        this.syntax = syntax.trim().toLowerCase(Locale.ROOT);
        this.platforms = platforms.stream()
                .map(p -> p.trim().toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * Statement usable on any platform.
     */
    public static SqlString universal(String sql) {
        return new SqlString(sql, UNIVERSAL, List.of("all"));
    }

    public boolean isUniversal() {
        return UNIVERSAL.equals(syntax) || platforms.contains("any") || platforms.contains("all");
    }

    @Override
    public String toString() {
        return syntax + platforms + ": " + sql;
    }
}
