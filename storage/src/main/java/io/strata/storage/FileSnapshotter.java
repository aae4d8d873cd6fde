// file: src/main/java/io/strata/storage/FileSnapshotter.java
package io.strata.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot implementation backed by a single file per snapshot.
 * <p>
 * Format:
 *   int64 lsn (little-endian)
 *   record frame (see {@link RecordCodec#frame(byte[])}) holding the image bytes
 * <p>
 * Atomicity:
 *   - We write to "snapshot-&lt;lsn&gt;.bin.tmp" first and fsync it,
 *   - then move to "snapshot-&lt;lsn&gt;.bin" using ATOMIC_MOVE.
 * <p>
 * Only the newest {@code keep} snapshots are kept on disk.
 */
public final class FileSnapshotter implements Snapshotter {
    private static final Logger log = Logger.getLogger(FileSnapshotter.class.getName());

    private final Path dir;
    private final int keep;

    public FileSnapshotter(Path dir) {
        this(dir, 2);
    }

    public FileSnapshotter(Path dir, int keep) {
        if (keep < 1) throw new IllegalArgumentException("keep must be >= 1");
        this.dir = dir;
        this.keep = keep;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    @Override
    public String writeSnapshot(long lsn, byte[] image) {
        String name = String.format("snapshot-%020d.bin", lsn);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        byte[] framed = RecordCodec.frame(image);
        ByteBuffer buf = ByteBuffer.allocate(8 + framed.length).order(ByteOrder.LITTLE_ENDIAN);
        buf.putLong(lsn).put(framed).flip();

        try (FileChannel out = FileChannel.open(tmp, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            while (buf.hasRemaining()) out.write(buf);
            out.force(true);
        } catch (IOException e) { throw new UncheckedIOException(e); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new UncheckedIOException(e); }

        pruneOld();
        log.log(Level.FINE, "Wrote snapshot {0} ({1} bytes)", new Object[]{name, image.length});
        return dst.getFileName().toString();
    }

    @Override
    public LoadedSnapshot loadLatest() {
        for (Path snap : snapshotsNewestFirst()) {
            try {
                byte[] all = Files.readAllBytes(snap);
                if (all.length < 8) throw new IOException("short file");
                long lsn = ByteBuffer.wrap(all, 0, 8).order(ByteOrder.LITTLE_ENDIAN).getLong();
                byte[] framed = new byte[all.length - 8];
                System.arraycopy(all, 8, framed, 0, framed.length);
                byte[] image = RecordCodec.unframe(framed);
                if (image == null) throw new IOException("bad header or CRC");
                return new LoadedSnapshot(snap.getFileName().toString(), lsn, image);
            } catch (IOException e) {
                log.log(Level.WARNING, "Skipping unreadable snapshot " + snap.getFileName(), e);
            }
        }
        return null;
    }

    private List<Path> snapshotsNewestFirst() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String n = p.getFileName().toString();
                        return n.startsWith("snapshot-") && n.endsWith(".bin");
                    })
                    .sorted(Comparator.comparing((Path p) -> p.getFileName().toString()).reversed())
                    .toList();
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private void pruneOld() {
        List<Path> all = snapshotsNewestFirst();
        for (int i = keep; i < all.size(); i++) {
            try {
                Files.deleteIfExists(all.get(i));
            } catch (IOException e) {
                log.log(Level.WARNING, "Could not delete old snapshot " + all.get(i), e);
            }
        }
    }
}
