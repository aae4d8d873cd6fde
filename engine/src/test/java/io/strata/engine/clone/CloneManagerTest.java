// file: src/test/java/io/strata/engine/clone/CloneManagerTest.java
package io.strata.engine.clone;

import io.strata.core.ConflictException;
import io.strata.core.Locator;
import io.strata.core.OperationKind;
import io.strata.core.Row;
import io.strata.core.StoredRow;
import io.strata.core.TableId;
import io.strata.core.TableState;
import io.strata.engine.MutableClock;
import io.strata.engine.timetravel.TimeTravelResolver;
import io.strata.storage.FileSegmentStore;
import io.strata.storage.TableCatalog;
import io.strata.storage.TableEntry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CloneManagerTest {

    @TempDir Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T08:00:00Z"));
    private TableCatalog catalog;
    private CloneManager clones;
    private TableId src;

    @BeforeEach
    void setUp() {
        catalog = TableCatalog.open(dir.resolve("catalog"),
                new FileSegmentStore(dir.resolve("segments"), Duration.ZERO, clock), 1000, clock);
        clones = new CloneManager(catalog, new TimeTravelResolver(catalog));
        src = catalog.createTable("COMPANY_METADATA", "v1", Duration.ofDays(1), "create").tableId();
        insert(src, "A", "{\"cik\":\"1\"}", "{\"cik\":\"2\"}");
        clock.advance(Duration.ofSeconds(5));
        insert(src, "B", "{\"cik\":\"3\"}");
    }

    @AfterEach
    void tearDown() {
        catalog.close();
    }

    private TableState insert(TableId t, String ref, String... json) {
        var seg = catalog.segments().put(Arrays.stream(json).map(Row::parse).toList());
        return catalog.appendState(t, catalog.head(t).stateId(), List.of(seg), Set.of(), OperationKind.INSERT, ref);
    }

    private List<Row> rows(TableId t) {
        return catalog.segments().scan(catalog.head(t)).stream().map(StoredRow::row).toList();
    }

    @Test
    void clone_reads_equal_the_source_at_the_located_state() {
        TableEntry atA = clones.clone(src, Locator.atStatement("A"), "DEV_A", "clone-a");
        TableEntry now = clones.clone(src, "DEV_NOW", "clone-now");

        assertEquals(List.of(Row.parse("{\"cik\":\"1\"}"), Row.parse("{\"cik\":\"2\"}")), rows(atA.tableId()));
        assertEquals(rows(src), rows(now.tableId()));
        assertEquals(catalog.head(src).segments(), catalog.head(now.tableId()).segments(), "no rows copied");
    }

    @Test
    void writes_after_the_clone_are_isolated_on_both_sides() {
        TableEntry dev = clones.clone(src, "DEV", "clone");
        List<Row> before = rows(src);

        insert(dev.tableId(), "dev-insert", "{\"cik\":\"99\"}");
        assertEquals(before, rows(src));
        assertEquals(before.size() + 1, rows(dev.tableId()).size());

        TableState head = catalog.head(src);
        StoredRow first = catalog.segments().scan(head).get(0);
        catalog.appendState(src, head.stateId(), List.of(), Set.of(first.id()), OperationKind.DELETE, "src-delete");
        assertEquals(before.size() - 1, rows(src).size());
        assertEquals(before.size() + 1, rows(dev.tableId()).size());
    }

    @Test
    void clone_only_adds_references() {
        int segmentsBefore = catalog.segments().segmentCount();
        TableState head = catalog.head(src);
        var seg = head.segments().iterator().next();
        int refsBefore = catalog.segments().refCount(seg);

        clones.clone(src, "DEV", "clone");

        assertEquals(segmentsBefore, catalog.segments().segmentCount());
        assertEquals(refsBefore + 1, catalog.segments().refCount(seg));
    }

    @Test
    void clone_name_must_be_free() {
        assertThrows(ConflictException.class, () -> clones.clone(src, "company_metadata", "dup"));
    }
}
