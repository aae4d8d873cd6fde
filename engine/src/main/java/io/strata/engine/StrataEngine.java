// file: engine/src/main/java/io/strata/engine/StrataEngine.java
package io.strata.engine;

import io.strata.engine.clone.CloneManager;
import io.strata.engine.maintenance.RetentionDaemon;
import io.strata.engine.security.AccessController;
import io.strata.engine.security.RoleGraph;
import io.strata.engine.timetravel.TimeTravelResolver;
import io.strata.storage.FileSegmentStore;
import io.strata.storage.TableCatalog;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Wires storage and engine components under one data directory:
 * <pre>
 *   &lt;dataDir&gt;/segments   segment files
 *   &lt;dataDir&gt;/catalog    catalog WAL + snapshots
 *   &lt;dataDir&gt;/security   role graph WAL + snapshots
 * </pre>
 */
public final class StrataEngine implements AutoCloseable {

    private final TableCatalog catalog;
    private final RoleGraph roles;
    private final TableService tables;
    private final AccessController access;
    private final RetentionDaemon retention;

    public StrataEngine(EngineConfig config, Clock clock) {
        Objects.requireNonNull(config, "config");
        Path root = config.dataPath();
        FileSegmentStore segments = new FileSegmentStore(root.resolve("segments"), Duration.ofMinutes(5), clock);
        this.catalog = TableCatalog.open(root.resolve("catalog"), segments, config.snapshotEvery(), clock);
        this.roles = RoleGraph.open(root.resolve("security"), config.snapshotEvery(), config.adminUser());
        this.access = new AccessController(roles);
        TimeTravelResolver resolver = new TimeTravelResolver(catalog);
        this.tables = new TableService(catalog, resolver, new CloneManager(catalog, resolver), access, config.retention());
        this.retention = new RetentionDaemon(catalog, config.purgeInterval());
    }

    public TableService tables() {
        return tables;
    }

    public AccessController access() {
        return access;
    }

    public TableCatalog catalog() {
        return catalog;
    }

    public RetentionDaemon retention() {
        return retention;
    }

    @Override
    public void close() {
        retention.stop();
        catalog.close();
        roles.close();
    }
}
