// file: src/main/java/io/strata/engine/clone/CloneManager.java
package io.strata.engine.clone;

import io.strata.core.Locator;
import io.strata.core.TableId;
import io.strata.core.TableState;
import io.strata.engine.timetravel.TimeTravelResolver;
import io.strata.storage.TableCatalog;
import io.strata.storage.TableEntry;

import java.util.Objects;

/**
 * Zero-copy table clones.
 * <p>
 * A clone is a new table whose root state lists exactly the segments of the
 * source state. No row is copied; the shared segments gain one reference each.
 * From then on the two chains evolve independently: a write to either side adds
 * segments only to its own chain.
 */
public final class CloneManager {

    private final TableCatalog catalog;
    private final TimeTravelResolver resolver;

    public CloneManager(TableCatalog catalog, TimeTravelResolver resolver) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    public TableEntry clone(TableId sourceTableId, String newName, String statementRef) {
        return clone(sourceTableId, Locator.current(), newName, statementRef);
    }

    /** Clone the source as of {@code locator} under {@code newName}. */
    public TableEntry clone(TableId sourceTableId, Locator locator, String newName, String statementRef) {
        TableState at = resolver.resolveState(sourceTableId, locator);
        return catalog.cloneTable(sourceTableId, at.stateId(), newName, statementRef);
    }
}
