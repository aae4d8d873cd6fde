// file: engine/src/main/java/io/strata/engine/TableService.java
package io.strata.engine;

import io.strata.core.Locator;
import io.strata.core.NotFoundException;
import io.strata.core.OperationKind;
import io.strata.core.Row;
import io.strata.core.RowId;
import io.strata.core.SegmentId;
import io.strata.core.StoredRow;
import io.strata.core.TableState;
import io.strata.engine.clone.CloneManager;
import io.strata.engine.projection.Projection;
import io.strata.engine.security.AccessController;
import io.strata.engine.security.Grant;
import io.strata.engine.security.ObjectRef;
import io.strata.engine.security.Privilege;
import io.strata.engine.security.SessionContext;
import io.strata.engine.timetravel.TimeTravelResolver;
import io.strata.storage.PurgeReport;
import io.strata.storage.TableCatalog;
import io.strata.storage.TableEntry;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Session-level entry point for table operations.
 * <p>
 * Every call:
 *  1) checks the session's privileges before touching storage,
 *  2) for writes: reads the head once, computes new rows and tombstones, stores the
 *     new segment, and appends a state against that head. A concurrent writer that
 *     got there first surfaces as {@link io.strata.core.ConflictException}; nothing is retried.
 *  3) logs the outcome through {@link OperationLogger}.
 * <p>
 * Tables are addressed by their visible name. Statement refs are generated when
 * the caller does not supply one; the returned state carries the ref for later
 * {@code AT(STATEMENT => ...)} / {@code BEFORE(STATEMENT => ...)} lookups.
 */
public final class TableService {

    private final TableCatalog catalog;
    private final TimeTravelResolver resolver;
    private final CloneManager clones;
    private final AccessController access;
    private final Duration defaultRetention;

    public TableService(TableCatalog catalog, TimeTravelResolver resolver, CloneManager clones,
                        AccessController access, Duration defaultRetention) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.clones = Objects.requireNonNull(clones, "clones");
        this.access = Objects.requireNonNull(access, "access");
        this.defaultRetention = Objects.requireNonNull(defaultRetention, "defaultRetention");
    }

    // ----------------- DDL -----------------

    /** {@code CREATE TABLE}; the session's role becomes the owner. */
    public TableEntry create(SessionContext session, String name, String schemaId) {
        return create(session, name, schemaId, defaultRetention);
    }

    public TableEntry create(SessionContext session, String name, String schemaId, Duration retention) {
        return logged("CREATE", name, session, () -> {
            ObjectRef ref = ObjectRef.table(name);
            access.require(session, Privilege.CREATE, ref.parent());
            TableEntry entry = catalog.createTable(name, schemaId, retention, newStatementRef());
            access.roles().grant(new Grant(session.role(), Privilege.OWNERSHIP, ref));
            return entry;
        });
    }

    /**
     * {@code CREATE OR REPLACE TABLE}: drops the visible table of that name (it stays
     * undroppable within its window) and creates a fresh one.
     */
    public TableEntry createOrReplace(SessionContext session, String name, String schemaId, Duration retention) {
        return logged("CREATE_OR_REPLACE", name, session, () -> {
            // all checks pass before the old table is dropped
            access.require(session, Privilege.CREATE, ObjectRef.table(name).parent());
            Optional<TableEntry> old = catalog.findByName(name);
            if (old.isPresent()) {
                access.require(session, Privilege.OWNERSHIP, ObjectRef.table(old.get().name()));
                catalog.drop(old.get().tableId());
            }
            return create(session, name, schemaId, retention);
        });
    }

    public TableEntry drop(SessionContext session, String name) {
        return logged("DROP", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.OWNERSHIP, ObjectRef.table(entry.name()));
            return catalog.drop(entry.tableId());
        });
    }

    /** {@code UNDROP TABLE}: restores the most recently dropped table of that name. */
    public TableEntry undrop(SessionContext session, String name) {
        return logged("UNDROP", name, session, () -> {
            TableEntry dropped = catalog.listDropped().stream()
                    .filter(e -> e.name().equalsIgnoreCase(name))
                    .max(Comparator.comparing(TableEntry::droppedAt))
                    .orElseThrow(() -> new NotFoundException("no dropped table named " + name));
            access.require(session, Privilege.OWNERSHIP, ObjectRef.table(dropped.name()));
            return catalog.undrop(dropped.tableId());
        });
    }

    /** {@code ALTER TABLE ... RENAME TO}; grants follow the table to its new name. */
    public TableEntry rename(SessionContext session, String name, String newName) {
        return logged("RENAME", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            ObjectRef from = ObjectRef.table(entry.name());
            ObjectRef to = ObjectRef.table(newName);
            access.require(session, Privilege.OWNERSHIP, from);
            access.require(session, Privilege.CREATE, to.parent());
            TableEntry renamed = catalog.rename(entry.tableId(), newName);
            access.roles().renameObject(from, to);
            return renamed;
        });
    }

    /** {@code CREATE TABLE newName CLONE name [AT|BEFORE(...)]}. */
    public TableEntry clone(SessionContext session, String name, String newName, Locator locator) {
        return logged("CLONE", name, session, () -> {
            TableEntry source = catalog.entryByName(name);
            access.require(session, Privilege.SELECT, ObjectRef.table(source.name()));
            ObjectRef target = ObjectRef.table(newName);
            access.require(session, Privilege.CREATE, target.parent());
            TableEntry clone = clones.clone(source.tableId(), locator, newName, newStatementRef());
            access.roles().grant(new Grant(session.role(), Privilege.OWNERSHIP, target));
            return clone;
        });
    }

    /**
     * {@code CREATE OR REPLACE TABLE name AS SELECT * FROM name BEFORE(...)}: the table's
     * content goes back to the located state. Additive: a DDL state is appended, so the
     * intervening history stays inspectable.
     */
    public TableState restore(SessionContext session, String name, Locator locator) {
        return logged("RESTORE", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.OWNERSHIP, ObjectRef.table(entry.name()));
            TableState source = resolver.resolveState(entry.tableId(), locator);
            TableState head = catalog.head(entry.tableId());
            return catalog.appendState(entry.tableId(), head.stateId(), List.copyOf(source.segments()), Set.of(),
                    OperationKind.DDL, newStatementRef());
        });
    }

    /** {@code CREATE TABLE target AS SELECT * FROM name AT|BEFORE(...)}, sharing segments. */
    public TableEntry restoreAs(SessionContext session, String name, Locator locator, String target) {
        return logged("RESTORE_AS", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.SELECT, ObjectRef.table(entry.name()));
            TableState source = resolver.resolveState(entry.tableId(), locator);
            TableEntry created = create(session, target, entry.schemaId(), entry.retention());
            catalog.appendState(created.tableId(), created.headStateId(), List.copyOf(source.segments()), Set.of(),
                    OperationKind.DDL, newStatementRef());
            return catalog.entry(created.tableId());
        });
    }

    // ----------------- DML -----------------

    public TableState insert(SessionContext session, String name, List<Row> rows) {
        return insert(session, name, rows, null);
    }

    /** {@code INSERT INTO name VALUES ...}; all rows land in one new segment. */
    public TableState insert(SessionContext session, String name, List<Row> rows, String statementRef) {
        return logged("INSERT", name, session, () -> {
            if (rows.isEmpty()) throw new IllegalArgumentException("nothing to insert");
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.INSERT, ObjectRef.table(entry.name()));
            TableState head = catalog.head(entry.tableId());
            SegmentId seg = catalog.segments().put(rows);
            return catalog.appendState(entry.tableId(), head.stateId(), List.of(seg), Set.of(),
                    OperationKind.INSERT, refOrNew(statementRef));
        });
    }

    public TableState update(SessionContext session, String name, Predicate<Row> where, UnaryOperator<Row> set) {
        return update(session, name, where, set, null);
    }

    /**
     * {@code UPDATE name SET ... WHERE ...}: matching rows are tombstoned and their
     * updated versions written to a new segment. With no match, nothing is written
     * and the head is returned.
     */
    public TableState update(SessionContext session, String name, Predicate<Row> where, UnaryOperator<Row> set,
                             String statementRef) {
        return logged("UPDATE", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.UPDATE, ObjectRef.table(entry.name()));
            TableState head = catalog.head(entry.tableId());
            Set<RowId> tombstones = new LinkedHashSet<>();
            List<Row> updated = new ArrayList<>();
            for (StoredRow r : catalog.segments().scan(head)) {
                if (where.test(r.row())) {
                    tombstones.add(r.id());
                    updated.add(set.apply(r.row()));
                }
            }
            if (tombstones.isEmpty()) return head;
            SegmentId seg = catalog.segments().put(updated);
            return catalog.appendState(entry.tableId(), head.stateId(), List.of(seg), tombstones,
                    OperationKind.UPDATE, refOrNew(statementRef));
        });
    }

    public TableState delete(SessionContext session, String name, Predicate<Row> where) {
        return delete(session, name, where, null);
    }

    /** {@code DELETE FROM name WHERE ...}. With no match, nothing is written and the head is returned. */
    public TableState delete(SessionContext session, String name, Predicate<Row> where, String statementRef) {
        return logged("DELETE", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.DELETE, ObjectRef.table(entry.name()));
            TableState head = catalog.head(entry.tableId());
            Set<RowId> tombstones = new LinkedHashSet<>();
            for (StoredRow r : catalog.segments().scan(head)) {
                if (where.test(r.row())) tombstones.add(r.id());
            }
            if (tombstones.isEmpty()) return head;
            return catalog.appendState(entry.tableId(), head.stateId(), List.of(), tombstones,
                    OperationKind.DELETE, refOrNew(statementRef));
        });
    }

    // ----------------- reads -----------------

    public List<Row> select(SessionContext session, String name) {
        return select(session, name, Locator.current());
    }

    /** {@code SELECT * FROM name [AT|BEFORE(...)]}. */
    public List<Row> select(SessionContext session, String name, Locator locator) {
        return logged("SELECT", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.SELECT, ObjectRef.table(entry.name()));
            TableState state = resolver.resolveState(entry.tableId(), locator);
            return catalog.segments().scan(state).stream().map(StoredRow::row).toList();
        });
    }

    /** Typed select through a projection, e.g. a view over a VARIANT column. */
    public List<Map<String, Object>> select(SessionContext session, String name, Locator locator, Projection projection) {
        return projection.applyAll(select(session, name, locator));
    }

    /** Retained states of the table, head first. */
    public List<TableState> history(SessionContext session, String name) {
        return logged("HISTORY", name, session, () -> {
            TableEntry entry = catalog.entryByName(name);
            access.require(session, Privilege.SELECT, ObjectRef.table(entry.name()));
            return catalog.history(entry.tableId());
        });
    }

    /** Visible tables the session can see (holds any privilege on). */
    public List<TableEntry> showTables(SessionContext session) {
        return catalog.listTables().stream()
                .filter(e -> access.check(session, Privilege.SELECT, ObjectRef.table(e.name()))
                        || access.check(session, Privilege.OWNERSHIP, ObjectRef.table(e.name())))
                .toList();
    }

    /** Run the retention purge now; account owners only. */
    public PurgeReport purge(SessionContext session) {
        return logged("PURGE", "ACCOUNT", session, () -> {
            access.require(session, Privilege.OWNERSHIP, ObjectRef.account());
            return catalog.purgeExpired();
        });
    }

    // ----------------- helpers -----------------

    private static <T> T logged(String operation, String target, SessionContext session, Supplier<T> body) {
        long start = System.nanoTime();
        try {
            T result = body.get();
            OperationLogger.logOperation(operation, target, session.role(), elapsedMillis(start), null);
            return result;
        } catch (RuntimeException e) {
            OperationLogger.logOperation(operation, target, session.role(), elapsedMillis(start), e);
            throw e;
        }
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private static String refOrNew(String statementRef) {
        return statementRef != null ? statementRef : newStatementRef();
    }

    private static String newStatementRef() {
        return UUID.randomUUID().toString();
    }
}
