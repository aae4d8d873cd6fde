// file: src/main/java/io/strata/engine/timetravel/TimeTravelResolver.java
package io.strata.engine.timetravel;

import io.strata.core.Locator;
import io.strata.core.NotFoundException;
import io.strata.core.OutOfRetentionException;
import io.strata.core.TableId;
import io.strata.core.TableState;
import io.strata.storage.TableCatalog;
import io.strata.storage.TableEntry;
import io.strata.storage.VersionChain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Maps a {@link Locator} to one state of a table's version chain.
 * <p>
 * Only history inside the table's retention window is reachable. The window
 * covers every state created after {@code now - retention} plus the state that
 * was current at that boundary instant. The walk goes from the head toward the
 * root by parent pointer and never mutates anything.
 * <p>
 * Dropped tables are resolved by id like live ones; purged tables are unknown.
 */
public final class TimeTravelResolver {

    private final TableCatalog catalog;

    public TimeTravelResolver(TableCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    /** State id the locator designates. */
    public long resolve(TableId tableId, Locator locator) {
        return resolveState(tableId, locator).stateId();
    }

    /**
     * @throws NotFoundException        unknown table, or a statement absent from complete in-window history
     * @throws OutOfRetentionException  the locator points before the retention window or into pruned history
     */
    public TableState resolveState(TableId tableId, Locator locator) {
        Objects.requireNonNull(locator, "locator");
        TableEntry entry = catalog.entry(tableId);
        VersionChain chain = catalog.chain(tableId);
        Instant boundary = catalog.clock().instant().minus(entry.retention());

        if (locator instanceof Locator.Current) {
            return chain.head();
        }
        if (locator instanceof Locator.AtTime at) {
            return atTime(entry, chain, at.instant(), boundary);
        }
        if (locator instanceof Locator.AtStatement at) {
            return byStatement(entry, chain, at.statementRef(), boundary);
        }
        Locator.BeforeStatement before = (Locator.BeforeStatement) locator;
        TableState produced = byStatement(entry, chain, before.statementRef(), boundary);
        if (produced.isRoot()) {
            throw new OutOfRetentionException("no state of " + entry.name() + " precedes statement "
                    + before.statementRef());
        }
        TableState parent = chain.get(produced.parentStateId());
        // the parent stopped being current when the statement committed
        if (parent == null || produced.createdAt().isBefore(boundary)) {
            throw new OutOfRetentionException("state before statement " + before.statementRef() + " of "
                    + entry.name() + " is outside the retention window");
        }
        return parent;
    }

    private static TableState atTime(TableEntry entry, VersionChain chain, Instant instant, Instant boundary) {
        if (instant.isBefore(boundary)) {
            throw new OutOfRetentionException(instant + " is before the retention window of " + entry.name()
                    + " (starts " + boundary + ")");
        }
        for (TableState s : chain.newestFirst()) {
            if (!s.createdAt().isAfter(instant)) return s;
        }
        throw new OutOfRetentionException("no state of " + entry.name() + " exists at " + instant);
    }

    private static TableState byStatement(TableEntry entry, VersionChain chain, String ref, Instant boundary) {
        List<TableState> states = chain.newestFirst();
        TableState last = null;
        for (TableState s : states) {
            if (s.statementRef().equals(ref)) return s;
            last = s;
            if (!s.createdAt().isAfter(boundary)) break; // the boundary state is the last one in the window
        }
        if (last != null && !last.isRoot()) {
            throw new OutOfRetentionException("statement " + ref + " not found in the retained history of "
                    + entry.name());
        }
        throw new NotFoundException("statement " + ref + " did not produce a state of " + entry.name());
    }
}
