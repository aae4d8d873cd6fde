// file: src/main/java/io/strata/storage/PurgeReport.java
package io.strata.storage;

import io.strata.core.TableId;

import java.util.List;

/**
 * Outcome of one {@link TableCatalog#purgeExpired()} run.
 *
 * @param purgedTables       dropped tables removed permanently
 * @param prunedStates       table states removed because they fell out of their window
 * @param reclaimedSegments  segment files deleted afterwards
 */
public record PurgeReport(List<TableId> purgedTables, int prunedStates, int reclaimedSegments) {
    public PurgeReport {
        purgedTables = List.copyOf(purgedTables);
    }

    public boolean isEmpty() {
        return purgedTables.isEmpty() && prunedStates == 0 && reclaimedSegments == 0;
    }
}
