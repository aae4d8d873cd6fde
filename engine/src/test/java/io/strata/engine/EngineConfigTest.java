package io.strata.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @TempDir Path dir;

    @Test
    void no_args_gives_defaults() {
        EngineConfig cfg = EngineConfig.fromArgs(new String[0]);
        assertEquals(EngineConfig.DEFAULTS, cfg);
        assertEquals(Duration.ofHours(24), cfg.retention());
        assertEquals(Duration.ofMinutes(5), cfg.purgeInterval());
    }

    @Test
    void flags_override_defaults() {
        EngineConfig cfg = EngineConfig.fromArgs(new String[]{
                "-d", "/tmp/strata", "--retention-hours", "48", "--purge-interval-seconds", "30",
                "--snapshot-every", "10", "--admin-user", "root", "--purge-once"});

        assertEquals(Path.of("/tmp/strata"), cfg.dataPath());
        assertEquals(48, cfg.retentionHours());
        assertEquals(30, cfg.purgeIntervalSeconds());
        assertEquals(10, cfg.snapshotEvery());
        assertEquals("root", cfg.adminUser());
        assertTrue(cfg.purgeOnce());
    }

    @Test
    void json_file_is_applied_before_flags() throws IOException {
        Path file = dir.resolve("engine.json");
        Files.writeString(file, "{\"dataDir\":\"/srv/strata\",\"retentionHours\":72,\"snapshotEvery\":50}");

        EngineConfig cfg = EngineConfig.fromArgs(new String[]{"--retention-hours", "1", "--config", file.toString()});

        assertEquals("/srv/strata", cfg.dataDir());
        assertEquals(1, cfg.retentionHours());
        assertEquals(50, cfg.snapshotEvery());
        assertEquals(300, cfg.purgeIntervalSeconds());
    }

    @Test
    void unknown_json_fields_fail_loading() throws IOException {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"retentionDays\":3}");
        assertThrows(UncheckedIOException.class, () -> EngineConfig.fromJsonFile(file, EngineConfig.DEFAULTS));
    }

    @Test
    void unreadable_config_file_fails_argument_parsing() {
        String missing = dir.resolve("missing.json").toString();
        assertThrows(UncheckedIOException.class, () -> EngineConfig.fromArgs(new String[]{"--config", missing}));
    }

    @Test
    void bad_flags_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[]{"--verbose"}));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[]{"--data-dir"}));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[]{"--retention-hours", "a day"}));
        assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromArgs(new String[]{"--snapshot-every", "0"}));
        assertThrows(IllegalArgumentException.class,
                () -> EngineConfig.fromArgs(new String[]{"--snapshot-every", "4294967297"}));
    }
}
