// file: src/main/java/io/strata/engine/maintenance/RetentionDaemon.java
package io.strata.engine.maintenance;

import io.strata.storage.PurgeReport;
import io.strata.storage.TableCatalog;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background daemon that periodically retires history outside retention windows
 * ({@link TableCatalog#purgeExpired()}).
 * <p>
 * Goals:
 *  - Keep purge off the request path.
 *  - At most one purge at a time: single-threaded scheduler, fixed delay.
 *  - A failed run is logged and the next tick tries again.
 */
public final class RetentionDaemon {
    private static final Logger log = Logger.getLogger(RetentionDaemon.class.getName());

    private final TableCatalog catalog;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;

    public RetentionDaemon(TableCatalog catalog, Duration interval) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        if (interval.isZero() || interval.isNegative()) throw new IllegalArgumentException("interval must be > 0");
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "retention-daemon");
            t.setDaemon(true);
            return t;
        });
    }

    /** Start periodic purging; the first run happens one interval after start. */
    public void start() {
        scheduler.scheduleWithFixedDelay(this::tickSafe, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.log(Level.INFO, "Retention daemon started, interval {0}", interval);
    }

    public void stop() {
        scheduler.shutdownNow();
    }

    /** One purge pass, run on the caller's thread. */
    public PurgeReport runOnce() {
        PurgeReport report = catalog.purgeExpired();
        log.log(report.isEmpty() ? Level.FINE : Level.INFO,
                "Retention pass: purged tables={0}, pruned states={1}, reclaimed segments={2}",
                new Object[]{report.purgedTables().size(), report.prunedStates(), report.reclaimedSegments()});
        return report;
    }

    // ---------- internals ----------

    private void tickSafe() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "Retention pass failed", e);
        }
    }
}
