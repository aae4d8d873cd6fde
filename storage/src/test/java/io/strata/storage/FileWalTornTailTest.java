package io.strata.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static java.nio.file.StandardOpenOption.APPEND;
import static org.junit.jupiter.api.Assertions.*;

class FileWalTornTailTest {

    @TempDir Path walDir;

    private static byte[] rec(long lsn, String body) {
        return RecordCodec.encode(lsn, "test", body.getBytes(StandardCharsets.UTF_8));
    }

    private static List<String> readAll(Wal wal) {
        List<String> out = new ArrayList<>();
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] p; (p = r.next()) != null; ) {
                out.add(new String(RecordCodec.decode(p).body(), StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    @Test
    void replay_ignores_truncated_tail_and_keeps_all_prior_records() throws Exception {
        var wal = new FileWal(walDir, 1L << 60); // huge rotate threshold so single segment
        wal.append(rec(1, "a"));
        wal.append(rec(2, "b"));
        byte[] r3 = rec(3, "c");
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(r3, 0, r3.length - 5); // header says "len" but payload is short
            out.flush();
        }
        wal.close();

        var reopened = new FileWal(walDir, 1L << 60);
        assertEquals(List.of("a", "b"), readAll(reopened));
        reopened.close();
    }

    @Test
    void appends_after_a_torn_tail_are_readable() throws Exception {
        var wal = new FileWal(walDir, 1L << 60);
        wal.append(rec(1, "a"));
        wal.close();
        Path seg = walDir.resolve("00000001.log");
        try (OutputStream out = Files.newOutputStream(seg, APPEND)) {
            out.write(new byte[]{0x01, 0x02, 0x03});
        }

        var reopened = new FileWal(walDir, 1L << 60);
        reopened.append(rec(2, "b"));
        assertEquals(List.of("a", "b"), readAll(reopened));
        reopened.close();
    }

    @Test
    void reader_spans_rotated_segments_and_checkpoint_keeps_one_interval() throws Exception {
        var wal = new FileWal(walDir, 1); // rotate after every record
        wal.append(rec(1, "a"));
        wal.rotateIfNeeded();
        wal.append(rec(2, "b"));
        wal.rotateIfNeeded();
        assertEquals(List.of("a", "b"), readAll(wal));

        // first checkpoint keeps everything: there is no earlier checkpoint to fall back on
        wal.checkpoint();
        assertEquals(List.of("a", "b"), readAll(wal));

        wal.append(rec(3, "c"));
        wal.checkpoint();
        assertEquals(List.of("c"), readAll(wal));
        try (var files = Files.list(walDir)) {
            assertEquals(2, files.count());
        }
        wal.close();
    }
}
