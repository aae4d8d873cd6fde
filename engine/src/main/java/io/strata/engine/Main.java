// file: engine/src/main/java/io/strata/engine/Main.java
package io.strata.engine;

import io.strata.storage.PurgeReport;
import io.strata.storage.TableEntry;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Process entry point: opens the engine over a data directory, recovers catalog and
 * roles, logs a summary, then either purges once and exits or keeps the retention
 * daemon running until the process is stopped.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        for (String a : args) {
            if (a.equals("--help") || a.equals("-h")) {
                printHelp();
                return;
            }
        }

        EngineConfig cfg;
        try {
            cfg = EngineConfig.fromArgs(args);
        } catch (IllegalArgumentException | UncheckedIOException e) {
            System.err.println(e.getMessage());
            printHelp();
            System.exit(1);
            return;
        }

        StrataEngine engine = new StrataEngine(cfg, Clock.systemUTC());
        for (TableEntry e : engine.catalog().listTables()) {
            log.log(Level.INFO, "table {0} head={1} retention={2}",
                    new Object[]{e.name(), e.headStateId(), e.retention()});
        }

        if (cfg.purgeOnce()) {
            PurgeReport report = engine.retention().runOnce();
            System.out.printf("purged tables=%d pruned states=%d reclaimed segments=%d%n",
                    report.purgedTables().size(), report.prunedStates(), report.reclaimedSegments());
            engine.close();
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        engine.retention().start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                engine.catalog().snapshot();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "Final snapshot failed", e);
            } finally {
                engine.close();
                stopped.countDown();
            }
        }, "strata-shutdown"));
        log.info("Strata engine running; data in " + cfg.dataPath().toAbsolutePath());
        stopped.await();
    }

    private static void configureLogging() {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) LogManager.getLogManager().readConfiguration(in);
        } catch (IOException e) {
            System.err.println("Could not load logging.properties: " + e.getMessage());
        }
    }

    private static void printHelp() {
        System.out.println("""
            Usage: strata [options]

            Options:
              --data-dir,  -d            Data directory (default: ./data)
              --retention-hours          Default table retention in hours (default: 24)
              --purge-interval-seconds   Delay between retention passes (default: 300)
              --snapshot-every           Journal records between snapshots (default: 1000)
              --admin-user               User granted ACCOUNTADMIN on first start (default: ADMIN)
              --config,    -c            JSON config file; other flags override it
              --purge-once               Run one retention pass and exit
              --help,      -h            Show this help message
            """);
    }
}
