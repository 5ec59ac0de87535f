package org.sqlver.version;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Dewey-decimal version number of a schema: a tuple of non-negative integers.
 *
 * <p>Comparison walks the components left to right. When one number runs out of components before
 * the other, the <em>longer</em> number is the earlier one, so {@code 1.2.3 < 1.2}.
 */
public final class SchemaVersionNumber implements Comparable<SchemaVersionNumber> {
    private final int[] decimals;

    private SchemaVersionNumber(int[] decimals) {
        this.decimals = decimals;
    }

    public static SchemaVersionNumber of(int... decimals) {
        if (decimals == null || decimals.length == 0) {
            throw new IllegalArgumentException("version number needs at least one decimal");
        }
        for (int d : decimals) {
            if (d < 0) {
                throw new IllegalArgumentException("version decimals must be non-negative: " + Arrays.toString(decimals));
            }
        }
        return new SchemaVersionNumber(decimals.clone());
    }

    public static SchemaVersionNumber of(List<Integer> decimals) {
        return of(decimals.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Parses {@code "1.2.3"}. Underscores are accepted as separators too.
     *
     * @throws IllegalArgumentException when the text is not a dotted decimal number
     */
    public static SchemaVersionNumber parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("version text must not be blank");
        }
        List<Integer> parts = new ArrayList<>();
        for (String part : text.trim().split("[._]")) {
            try {
                parts.add(Integer.parseInt(part));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid version number '" + text + "'", e);
            }
        }
        return of(parts);
    }

    public int depth() {
        return decimals.length;
    }

    public int get(int index) {
        return decimals[index];
    }

    public List<Integer> decimals() {
        return Arrays.stream(decimals).boxed().toList();
    }

    /**
     * True when {@code other} has all of this number's decimals plus more below them.
     */
    public boolean isParentDecimalOf(SchemaVersionNumber other) {
        if (other.depth() <= depth()) {
            return false;
        }
        for (int i = 0; i < depth(); i++) {
            if (other.decimals[i] != decimals[i]) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when both numbers have the same depth and agree on every decimal but the last.
     */
    public boolean isSiblingDecimalOf(SchemaVersionNumber other) {
        if (other.depth() != depth()) {
            return false;
        }
        for (int i = 0; i < depth() - 1; i++) {
            if (other.decimals[i] != decimals[i]) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int compareTo(SchemaVersionNumber other) {
        int n = Math.min(decimals.length, other.decimals.length);
        for (int i = 0; i < n; i++) {
            int c = Integer.compare(decimals[i], other.decimals[i]);
            if (c != 0) {
                return c;
            }
        }
        // 공통 부분이 같으면 더 긴 쪽이 앞선(작은) 버전
        return Integer.compare(other.decimals.length, decimals.length);
    }

    public boolean isBefore(SchemaVersionNumber other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(SchemaVersionNumber other) {
        return compareTo(other) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SchemaVersionNumber v)) return false;
        return Arrays.equals(decimals, v.decimals);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(decimals);
    }

    @Override
    public String toString() {
        return Arrays.stream(decimals).mapToObj(String::valueOf).collect(Collectors.joining("."));
    }
}
