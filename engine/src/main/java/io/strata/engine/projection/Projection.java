// file: src/main/java/io/strata/engine/projection/Projection.java
package io.strata.engine.projection;

import io.strata.core.Row;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * An ordered list of column specs applied to rows, the typed view over VARIANT rows
 * a {@code CREATE VIEW ... AS SELECT v:a::string AS a, ...} defines.
 */
public final class Projection {

    private final List<ColumnSpec> columns;

    private Projection(List<ColumnSpec> columns) {
        if (columns.isEmpty()) throw new IllegalArgumentException("a projection needs at least one column");
        Set<String> seen = new HashSet<>();
        for (ColumnSpec c : columns) {
            if (!seen.add(c.normalizedAlias())) throw new IllegalArgumentException("duplicate column alias " + c.alias());
        }
        this.columns = List.copyOf(columns);
    }

    public static Projection of(ColumnSpec... columns) {
        return new Projection(List.of(columns));
    }

    public static Projection of(List<ColumnSpec> columns) {
        return new Projection(columns);
    }

    /** Build from select-list items, see {@link ColumnSpec#parse(String)}. */
    public static Projection parse(String... items) {
        List<ColumnSpec> specs = new ArrayList<>(items.length);
        for (String item : items) specs.add(ColumnSpec.parse(item));
        return new Projection(specs);
    }

    public List<ColumnSpec> columns() {
        return columns;
    }

    /**
     * Project one row. Values are keyed by alias in column order; absent paths map to null.
     *
     * @throws io.strata.core.CastException if a present value cannot be converted
     */
    public Map<String, Object> apply(Row row) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (ColumnSpec c : columns) out.put(c.alias(), c.project(row.asVariant()));
        return Collections.unmodifiableMap(out);
    }

    public List<Map<String, Object>> applyAll(List<Row> rows) {
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (Row r : rows) out.add(apply(r));
        return out;
    }
}
