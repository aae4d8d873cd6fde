// file: src/main/java/io/strata/core/StoredRow.java
package io.strata.core;

import java.util.Objects;

/** A row as read from a table state, together with the address writes use to tombstone it. */
public record StoredRow(RowId id, Row row) {
    public StoredRow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(row, "row");
    }
}
