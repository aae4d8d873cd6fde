// file: src/test/java/io/strata/storage/TableCatalogTest.java
package io.strata.storage;

import io.strata.core.ConflictException;
import io.strata.core.NotFoundException;
import io.strata.core.OperationKind;
import io.strata.core.Row;
import io.strata.core.RowId;
import io.strata.core.SegmentId;
import io.strata.core.StoredRow;
import io.strata.core.TableId;
import io.strata.core.TableState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class TableCatalogTest {

    @TempDir Path dataDir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
    private final List<TableCatalog> opened = new ArrayList<>();

    private TableCatalog open(int snapshotEvery) {
        var segs = new FileSegmentStore(dataDir.resolve("segments"), Duration.ZERO, clock);
        var catalog = TableCatalog.open(dataDir.resolve("catalog"), segs, snapshotEvery, clock);
        opened.add(catalog);
        return catalog;
    }

    @AfterEach
    void closeAll() {
        opened.forEach(TableCatalog::close);
    }

    private static List<Row> rows(String... json) {
        List<Row> out = new ArrayList<>();
        for (String j : json) out.add(Row.parse(j));
        return out;
    }

    private static TableState insert(TableCatalog c, TableId t, SegmentId seg, String ref) {
        return c.appendState(t, c.head(t).stateId(), List.of(seg), Set.of(), OperationKind.INSERT, ref);
    }

    private static List<Row> read(TableCatalog c, TableState s) {
        return c.segments().scan(s).stream().map(StoredRow::row).toList();
    }

    @Test
    void worked_example_two_inserts_and_a_look_back() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId seg1 = c.segments().put(rows("{\"id\":1,\"name\":\"A\"}"));
        TableState s0 = insert(c, t, seg1, "q0");
        SegmentId seg2 = c.segments().put(rows("{\"id\":2,\"name\":\"B\"}"));
        TableState s1 = insert(c, t, seg2, "q1");

        assertEquals(Set.of(seg1), s0.segments());
        assertEquals(Set.of(seg1, seg2), s1.segments());
        assertEquals(s0.stateId(), s1.parentStateId());
        assertTrue(s1.stateId() > s0.stateId());
        assertEquals(s1, c.head(t));
        assertEquals(1, read(c, c.chain(t).get(s0.stateId())).size());
        assertEquals(2, read(c, s1).size());
        assertEquals(2, c.segments().refCount(seg1));
        assertEquals(1, c.segments().refCount(seg2));
    }

    @Test
    void stale_parent_is_a_conflict_and_changes_nothing() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        long root = c.head(t).stateId();
        SegmentId seg = c.segments().put(rows("{\"id\":1}"));
        insert(c, t, seg, "q1");

        SegmentId other = c.segments().put(rows("{\"id\":2}"));
        assertThrows(ConflictException.class,
                () -> c.appendState(t, root, List.of(other), Set.of(), OperationKind.INSERT, "q2"));
        assertEquals(2, c.history(t).size());
        assertEquals(0, c.segments().refCount(other));
    }

    @Test
    void concurrent_appends_on_one_parent_have_exactly_one_winner() throws Exception {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        long parent = c.head(t).stateId();
        int writers = 8;
        List<SegmentId> segs = new ArrayList<>();
        for (int i = 0; i < writers; i++) segs.add(c.segments().put(rows("{\"w\":" + i + "}")));

        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TableState>> results = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            SegmentId seg = segs.get(i);
            results.add(pool.submit(() -> {
                start.await();
                return c.appendState(t, parent, List.of(seg), Set.of(), OperationKind.INSERT, "w-" + seg.shortHex());
            }));
        }
        start.countDown();

        int wins = 0;
        int conflicts = 0;
        for (Future<TableState> f : results) {
            try {
                f.get();
                wins++;
            } catch (java.util.concurrent.ExecutionException e) {
                assertInstanceOf(ConflictException.class, e.getCause());
                conflicts++;
            }
        }
        pool.shutdown();

        assertEquals(1, wins);
        assertEquals(writers - 1, conflicts);
        List<TableState> history = c.history(t);
        assertEquals(2, history.size());
        Set<Long> ids = new HashSet<>();
        history.forEach(s -> ids.add(s.stateId()));
        assertEquals(2, ids.size());
    }

    @Test
    void delete_rewrites_the_touched_segment_and_keeps_the_old_state_readable() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId seg = c.segments().put(rows("{\"id\":1}", "{\"id\":2}", "{\"id\":3}"));
        TableState before = insert(c, t, seg, "ins");

        TableState after = c.appendState(t, before.stateId(), List.of(), Set.of(new RowId(seg, 1)),
                OperationKind.DELETE, "del");

        assertFalse(after.segments().contains(seg));
        assertEquals(1, after.addedSegments().size());
        assertEquals(rows("{\"id\":1}", "{\"id\":3}"), read(c, after));
        assertEquals(rows("{\"id\":1}", "{\"id\":2}", "{\"id\":3}"), read(c, before));
    }

    @Test
    void deleting_every_row_of_a_segment_removes_it() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId seg = c.segments().put(rows("{\"id\":1}"));
        TableState before = insert(c, t, seg, "ins");

        TableState after = c.appendState(t, before.stateId(), List.of(), Set.of(new RowId(seg, 0)),
                OperationKind.DELETE, "del");

        assertTrue(after.segments().isEmpty());
        assertTrue(after.addedSegments().isEmpty());
    }

    @Test
    void inserting_identical_rows_twice_keeps_both_copies() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId seg = c.segments().put(rows("{\"id\":1}"));
        insert(c, t, seg, "first");
        TableState second = insert(c, t, c.segments().put(rows("{\"id\":1}")), "second");

        assertEquals(rows("{\"id\":1}", "{\"id\":1}"), read(c, second));
    }

    @Test
    void tombstone_outside_the_parent_is_rejected() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId seg = c.segments().put(rows("{\"id\":1}"));
        TableState head = insert(c, t, seg, "ins");

        assertThrows(IllegalArgumentException.class, () -> c.appendState(t, head.stateId(), List.of(),
                Set.of(new RowId(seg, 5)), OperationKind.DELETE, "bad"));
        SegmentId stray = c.segments().put(rows("{\"id\":9}"));
        assertThrows(IllegalArgumentException.class, () -> c.appendState(t, head.stateId(), List.of(),
                Set.of(new RowId(stray, 0)), OperationKind.DELETE, "bad"));
        assertEquals(head, c.head(t));
    }

    @Test
    void unknown_segment_and_unknown_table_are_not_found() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId ghost = new SegmentId("ab".repeat(32));

        assertThrows(NotFoundException.class, () -> insert(c, t, ghost, "x"));
        assertThrows(NotFoundException.class, () -> c.appendState(TableId.random(), 1, List.of(), Set.of(),
                OperationKind.INSERT, "x"));
    }

    @Test
    void ddl_state_redefines_the_segment_set() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId a = c.segments().put(rows("{\"id\":1}"));
        TableState first = insert(c, t, a, "a");
        SegmentId b = c.segments().put(rows("{\"id\":2}"));
        insert(c, t, b, "b");

        TableState restored = c.appendState(t, c.head(t).stateId(), List.copyOf(first.segments()), Set.of(),
                OperationKind.DDL, "restore");

        assertEquals(Set.of(a), restored.segments());
        assertEquals(4, c.history(t).size(), "history stays inspectable");
        assertThrows(IllegalArgumentException.class, () -> c.appendState(t, restored.stateId(), List.of(a),
                Set.of(new RowId(a, 0)), OperationKind.DDL, "bad"));
    }

    @Test
    void names_are_unique_among_visible_tables_case_insensitively() {
        var c = open(1000);
        c.createTable("Orders", "v1", Duration.ofDays(1), "c1");
        assertThrows(ConflictException.class, () -> c.createTable("ORDERS", "v1", Duration.ofDays(1), "c2"));
        assertEquals("Orders", c.entryByName("orders").name());
    }

    @Test
    void drop_hides_the_name_and_undrop_restores_the_same_head() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofHours(1), "create").tableId();
        TableState head = insert(c, t, c.segments().put(rows("{\"id\":1}")), "ins");

        c.drop(t);
        assertTrue(c.findByName("T").isEmpty());
        assertTrue(c.entry(t).isDropped());
        assertEquals(List.of(t), c.listDropped().stream().map(TableEntry::tableId).toList());
        assertThrows(NotFoundException.class, () -> insert(c, t, c.segments().put(rows("{\"id\":2}")), "late"));

        clock.advance(Duration.ofMinutes(30));
        c.undrop(t);
        assertEquals(t, c.entryByName("T").tableId());
        assertEquals(head.stateId(), c.entry(t).headStateId());
    }

    @Test
    void undrop_after_the_window_is_not_found() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofHours(1), "create").tableId();
        c.drop(t);
        clock.advance(Duration.ofHours(2));
        assertThrows(NotFoundException.class, () -> c.undrop(t));
    }

    @Test
    void undrop_into_a_taken_name_conflicts_until_the_newcomer_is_renamed() {
        var c = open(1000);
        TableId old = c.createTable("T", "v1", Duration.ofDays(1), "c1").tableId();
        c.drop(old);
        TableId replacement = c.createTable("T", "v2", Duration.ofDays(1), "c2").tableId();

        assertThrows(ConflictException.class, () -> c.undrop(old));
        c.rename(replacement, "T_NEW");
        c.undrop(old);

        assertEquals(old, c.entryByName("T").tableId());
        assertEquals(replacement, c.entryByName("t_new").tableId());
    }

    @Test
    void clone_shares_segments_and_records_lineage() {
        var c = open(1000);
        TableId src = c.createTable("SRC", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId seg = c.segments().put(rows("{\"id\":1}"));
        TableState at = insert(c, src, seg, "ins");

        TableEntry clone = c.cloneTable(src, at.stateId(), "DST", "clone");

        TableState root = c.head(clone.tableId());
        assertEquals(OperationKind.CLONE, root.operation());
        assertTrue(root.isRoot());
        assertEquals(at.segments(), root.segments());
        assertEquals(2, c.segments().refCount(seg));
        assertEquals(src, c.cloneOrigin(clone.tableId()).orElseThrow().sourceTableId());
        assertEquals(c.entry(src).retention(), clone.retention());
        assertThrows(ConflictException.class, () -> c.cloneTable(src, at.stateId(), "dst", "again"));
    }

    @Test
    void catalog_survives_restart() {
        var c1 = open(1000);
        TableId t = c1.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        SegmentId seg = c1.segments().put(rows("{\"id\":1}"));
        TableState head = insert(c1, t, seg, "ins");
        TableEntry clone = c1.cloneTable(t, head.stateId(), "C", "clone");
        TableId gone = c1.createTable("GONE", "v1", Duration.ofDays(1), "create-gone").tableId();
        c1.drop(gone);
        long last = c1.lastStateId();
        c1.close();
        opened.remove(c1);

        var c2 = open(1000);
        assertEquals(head, c2.head(t));
        assertEquals(2, c2.history(t).size());
        assertEquals(clone.tableId(), c2.entryByName("C").tableId());
        assertTrue(c2.cloneOrigin(clone.tableId()).isPresent());
        assertTrue(c2.findByName("GONE").isEmpty());
        assertTrue(c2.entry(gone).isDropped());
        assertEquals(2, c2.segments().refCount(seg));
        assertEquals(last, c2.lastStateId());

        TableState next = insert(c2, t, c2.segments().put(rows("{\"id\":2}")), "after-restart");
        assertTrue(next.stateId() > last);
    }

    @Test
    void catalog_survives_restart_from_snapshot() {
        var c1 = open(1); // snapshot after every record
        TableId t = c1.createTable("T", "v1", Duration.ofDays(1), "create").tableId();
        TableState head = insert(c1, t, c1.segments().put(rows("{\"id\":1}")), "ins");
        c1.rename(t, "RENAMED");
        c1.close();
        opened.remove(c1);

        var c2 = open(1);
        assertEquals(head, c2.head(t));
        assertEquals(t, c2.entryByName("renamed").tableId());
        assertTrue(c2.findByName("T").isEmpty());
    }

    @Test
    void purge_prunes_only_history_outside_the_window() {
        var c = open(1000);
        TableId t = c.createTable("T", "v1", Duration.ofHours(1), "create").tableId();
        SegmentId a = c.segments().put(rows("{\"id\":1}"));
        insert(c, t, a, "a");
        clock.advance(Duration.ofMinutes(30));
        SegmentId b = c.segments().put(rows("{\"id\":2}"));
        TableState sb = insert(c, t, b, "b");
        clock.advance(Duration.ofHours(2));
        TableState sc = c.appendState(t, sb.stateId(), List.of(), Set.of(new RowId(a, 0)),
                OperationKind.DELETE, "c");

        PurgeReport report = c.purgeExpired();

        assertEquals(2, report.prunedStates(), "root and 'a' are older than the state valid at the boundary");
        assertEquals(List.of(sc, sb), c.history(t));
        assertTrue(c.chain(t).isTruncated());
        assertTrue(c.segments().contains(a), "still visible in the boundary state");

        clock.advance(Duration.ofHours(2));
        report = c.purgeExpired();
        assertEquals(1, report.prunedStates());
        assertFalse(c.segments().contains(a));
        assertEquals(1, report.reclaimedSegments());
    }

    @Test
    void purge_removes_dropped_tables_past_retention_and_reclaims_their_segments() {
        var c = open(1000);
        TableId keep = c.createTable("KEEP", "v1", Duration.ofDays(7), "k").tableId();
        TableId t = c.createTable("T", "v1", Duration.ofHours(1), "create").tableId();
        SegmentId seg = c.segments().put(rows("{\"only\":\"here\"}"));
        insert(c, t, seg, "ins");
        c.drop(t);

        assertTrue(c.purgeExpired().purgedTables().isEmpty(), "still inside the window");

        clock.advance(Duration.ofHours(2));
        PurgeReport report = c.purgeExpired();

        assertEquals(List.of(t), report.purgedTables());
        assertThrows(NotFoundException.class, () -> c.entry(t));
        assertFalse(c.segments().contains(seg));
        assertEquals(keep, c.entryByName("KEEP").tableId());
    }
}
