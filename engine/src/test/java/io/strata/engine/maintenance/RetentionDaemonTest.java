// file: src/test/java/io/strata/engine/maintenance/RetentionDaemonTest.java
package io.strata.engine.maintenance;

import io.strata.core.OperationKind;
import io.strata.core.Row;
import io.strata.core.SegmentId;
import io.strata.core.TableId;
import io.strata.engine.MutableClock;
import io.strata.storage.FileSegmentStore;
import io.strata.storage.PurgeReport;
import io.strata.storage.TableCatalog;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RetentionDaemonTest {

    @TempDir Path dir;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-06-03T09:00:00Z"));
    private TableCatalog catalog;

    @BeforeEach
    void setUp() {
        var segments = new FileSegmentStore(dir.resolve("segments"), Duration.ofMinutes(5), clock);
        catalog = TableCatalog.open(dir.resolve("catalog"), segments, 100, clock);
    }

    @AfterEach
    void tearDown() {
        catalog.close();
    }

    private void insert(TableId t, String json) {
        SegmentId seg = catalog.segments().put(List.of(Row.parse(json)));
        catalog.appendState(t, catalog.head(t).stateId(), List.of(seg), Set.of(), OperationKind.INSERT, json);
    }

    @Test
    void run_once_prunes_states_then_purges_dropped_tables() {
        TableId t = catalog.createTable("events", "s1", Duration.ofHours(1), "create").tableId();
        insert(t, "{\"id\":1}");
        clock.advance(Duration.ofMinutes(10));
        insert(t, "{\"id\":2}");

        var daemon = new RetentionDaemon(catalog, Duration.ofMinutes(5));
        assertTrue(daemon.runOnce().isEmpty(), "everything is still inside the window");

        clock.advance(Duration.ofHours(3));
        PurgeReport pruned = daemon.runOnce();
        assertEquals(2, pruned.prunedStates());
        assertEquals(0, pruned.reclaimedSegments(), "both segments are still visible at the head");
        assertEquals(1, catalog.history(t).size());

        catalog.drop(t);
        clock.advance(Duration.ofHours(2));
        PurgeReport purged = daemon.runOnce();
        assertEquals(List.of(t), purged.purgedTables());
        assertEquals(2, purged.reclaimedSegments());
        assertEquals(0, catalog.segments().segmentCount());
        assertTrue(catalog.findEntry(t).isEmpty());
    }

    @Test
    void start_and_stop_do_not_block() {
        var daemon = new RetentionDaemon(catalog, Duration.ofMillis(10));
        daemon.start();
        daemon.stop();
        assertTrue(daemon.runOnce().isEmpty());
    }

    @Test
    void interval_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new RetentionDaemon(catalog, Duration.ZERO));
    }
}
