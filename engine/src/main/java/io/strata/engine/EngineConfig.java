// file: engine/src/main/java/io/strata/engine/EngineConfig.java
package io.strata.engine;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Engine configuration parsed from CLI args, optionally seeded from a JSON file.
 * <p>
 * Supports:
 *  - dataDir:              root directory for segments, catalog and role journals
 *  - retentionHours:       default retention window for new tables
 *  - purgeIntervalSeconds: delay between retention daemon runs
 *  - snapshotEvery:        journal records between full snapshots
 *  - adminUser:            user that receives ACCOUNTADMIN on first start
 *  - purgeOnce:            run one purge and exit instead of starting the daemon
 */
public record EngineConfig(
        String dataDir,
        long retentionHours,
        long purgeIntervalSeconds,
        int snapshotEvery,
        String adminUser,
        boolean purgeOnce
) {

    public static final EngineConfig DEFAULTS = new EngineConfig("./data", 24, 300, 1000, "ADMIN", false);

    public EngineConfig {
        if (dataDir == null || dataDir.isBlank()) throw new IllegalArgumentException("data-dir must not be blank");
        if (retentionHours < 0) throw new IllegalArgumentException("retention-hours must be >= 0");
        if (purgeIntervalSeconds <= 0) throw new IllegalArgumentException("purge-interval-seconds must be > 0");
        if (snapshotEvery <= 0) throw new IllegalArgumentException("snapshot-every must be > 0");
        if (adminUser == null || adminUser.isBlank()) throw new IllegalArgumentException("admin-user must not be blank");
    }

    /** JSON shape of the optional config file; absent fields keep their defaults. */
    public static class JsonConfig {
        public String dataDir;
        public Long retentionHours;
        public Long purgeIntervalSeconds;
        public Integer snapshotEvery;
        public String adminUser;
    }

    public Path dataPath() {
        return Path.of(dataDir);
    }

    public Duration retention() {
        return Duration.ofHours(retentionHours);
    }

    public Duration purgeInterval() {
        return Duration.ofSeconds(purgeIntervalSeconds);
    }

    /**
     * Very small CLI parser.
     * <p>
     * Supported flags:
     *   --data-dir,  -d  &lt;path&gt;
     *   --retention-hours &lt;hours&gt;
     *   --purge-interval-seconds &lt;seconds&gt;
     *   --snapshot-every &lt;records&gt;
     *   --admin-user &lt;name&gt;
     *   --config,    -c  &lt;json file&gt;   (applied first; other flags override it)
     *   --purge-once
     * <p>
     * {@code --help} is handled by {@code Main}.
     *
     * @throws IllegalArgumentException on an unknown flag, a missing value or a bad number
     * @throws UncheckedIOException when a {@code --config} file cannot be read or parsed
     */
    public static EngineConfig fromArgs(String[] args) {
        EngineConfig base = DEFAULTS;
        for (int i = 0; i < args.length; i++) {
            if (args[i].equals("--config") || args[i].equals("-c")) {
                ensureValue(args, i);
                base = fromJsonFile(Path.of(args[i + 1]), base);
            }
        }

        String dataDir = base.dataDir;
        long retentionHours = base.retentionHours;
        long purgeIntervalSeconds = base.purgeIntervalSeconds;
        int snapshotEvery = base.snapshotEvery;
        String adminUser = base.adminUser;
        boolean purgeOnce = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config", "-c" -> i++;

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--retention-hours" -> {
                    ensureValue(args, i);
                    retentionHours = parseLong(args[i], args[++i]);
                }

                case "--purge-interval-seconds" -> {
                    ensureValue(args, i);
                    purgeIntervalSeconds = parseLong(args[i], args[++i]);
                }

                case "--snapshot-every" -> {
                    ensureValue(args, i);
                    snapshotEvery = parseInt(args[i], args[++i]);
                }

                case "--admin-user" -> {
                    ensureValue(args, i);
                    adminUser = args[++i];
                }

                case "--purge-once" -> purgeOnce = true;

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }
        return new EngineConfig(dataDir, retentionHours, purgeIntervalSeconds, snapshotEvery, adminUser, purgeOnce);
    }

    /** Overlay the fields present in a JSON file onto {@code base}. */
    public static EngineConfig fromJsonFile(Path path, EngineConfig base) {
        ObjectMapper mapper = new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        try {
            JsonConfig cfg = mapper.readValue(path.toFile(), JsonConfig.class);
            return new EngineConfig(
                    cfg.dataDir != null ? cfg.dataDir : base.dataDir,
                    cfg.retentionHours != null ? cfg.retentionHours : base.retentionHours,
                    cfg.purgeIntervalSeconds != null ? cfg.purgeIntervalSeconds : base.purgeIntervalSeconds,
                    cfg.snapshotEvery != null ? cfg.snapshotEvery : base.snapshotEvery,
                    cfg.adminUser != null ? cfg.adminUser : base.adminUser,
                    base.purgeOnce
            );
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load engine config from " + path, e);
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) throw new IllegalArgumentException("Missing value for option: " + args[i]);
    }

    private static int parseInt(String flag, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + value, e);
        }
    }

    private static long parseLong(String flag, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag + ": " + value, e);
        }
    }
}
