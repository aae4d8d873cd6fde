// file: src/main/java/io/strata/core/Row.java
package io.strata.core;

import io.strata.core.variant.Variant;
import io.strata.core.variant.Variants;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One table row: an ordered, immutable mapping from column name to value.
 * A VARIANT column simply holds an object or array tree; scalar columns hold
 * scalar variants.
 */
public final class Row {
    private final Variant.Obj columns;

    private Row(Variant.Obj columns) {
        this.columns = columns;
    }

    public static Row of(Map<String, ? extends Variant> columns) {
        return new Row(Variant.object(columns));
    }

    public static Row of(Variant.Obj columns) {
        return new Row(Objects.requireNonNull(columns, "columns"));
    }

    /**
     * Parse a JSON object into a row, e.g. {@code {"id":1,"name":"A"}}.
     *
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Row parse(String json) {
        Variant v = Variants.parse(json);
        if (!(v instanceof Variant.Obj o)) {
            throw new IllegalArgumentException("a row must be a JSON object, got " + v.kind());
        }
        return new Row(o);
    }

    /** Column value, or the null variant when the row has no such column. */
    public Variant get(String column) {
        return columns.get(column);
    }

    public Map<String, Variant> columns() {
        return columns.fields();
    }

    /** A copy of this row with one column set (added at the end when new). */
    public Row with(String column, Variant value) {
        var copy = new LinkedHashMap<>(columns.fields());
        copy.put(column, value == null ? Variant.NULL : value);
        return new Row(new Variant.Obj(copy));
    }

    public Variant.Obj asVariant() {
        return columns;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row other)) return false;
        return columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return columns.hashCode();
    }

    @Override
    public String toString() {
        return Variants.toJson(columns);
    }
}
