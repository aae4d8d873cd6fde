// file: src/main/java/io/strata/storage/TableEntry.java
package io.strata.storage;

import io.strata.core.TableId;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Catalog row for one table.
 * <p>
 * A dropped table keeps its entry and chain until {@code droppedAt + retention}
 * has passed; in the meantime it is reachable by id but not by name.
 */
public record TableEntry(
        TableId tableId,
        String name,
        String schemaId,
        long headStateId,
        Duration retention,
        Instant createdAt,
        Instant droppedAt
) {
    public TableEntry {
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(schemaId, "schemaId");
        Objects.requireNonNull(retention, "retention");
        Objects.requireNonNull(createdAt, "createdAt");
        if (retention.isNegative()) throw new IllegalArgumentException("retention must be >= 0");
    }

    public boolean isDropped() {
        return droppedAt != null;
    }

    public TableEntry withHead(long stateId) {
        return new TableEntry(tableId, name, schemaId, stateId, retention, createdAt, droppedAt);
    }

    public TableEntry withDroppedAt(Instant at) {
        return new TableEntry(tableId, name, schemaId, headStateId, retention, createdAt, at);
    }

    public TableEntry withName(String newName) {
        return new TableEntry(tableId, newName, schemaId, headStateId, retention, createdAt, droppedAt);
    }
}
