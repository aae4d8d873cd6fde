// file: src/main/java/io/strata/core/TableId.java
package io.strata.core;

import java.util.Objects;
import java.util.UUID;

/** Stable identity of a table, independent of its (reusable) name. */
public record TableId(String value) {
    public TableId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) throw new IllegalArgumentException("table id must not be blank");
    }

    public static TableId random() {
        return new TableId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
