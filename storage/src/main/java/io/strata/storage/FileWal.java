// file: src/main/java/io/strata/storage/FileWal.java
package io.strata.storage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * File-backed WAL that appends header+payload records to segment files.
 * <p>
 * Properties:
 *  - On construction, it:
 *      - creates the directory if needed,
 *      - finds the newest segment (e.g. "00000001.log", "00000002.log", ...),
 *      - cuts any torn tail off it (bytes after the last valid record),
 *      - opens it for append.
 * <p>
 *  - append():
 *      - writes the bytes,
 *      - calls force(true) to fsync data and metadata,
 *      - tracks bytes written this segment.
 * <p>
 *  - rotateIfNeeded():
 *      - when written bytes >= rotateBytes, closes current segment and opens
 *        a new one with incremented index, resetting the counter.
 * <p>
 *  - checkpoint():
 *      - opens the next segment and deletes the segments older than the one
 *        the previous checkpoint opened, so the WAL still reaches back to the
 *        snapshot before the newest one.
 * <p>
 *  - Reader:
 *      - walks every segment in index order,
 *      - reads fixed-size header (11 bytes),
 *      - validates magic/version/length,
 *      - reads payload, validates CRC,
 *      - stops at the first truncated header/payload or bad CRC.
 */
public class FileWal implements Wal {
    private static final Logger log = Logger.getLogger(FileWal.class.getName());

    private final Path dir;
    private final long rotateBytes;
    private FileChannel ch;
    private Path current;
    private long writtenInSegment = 0;
    private Path retainFrom;

    public FileWal(Path dir, long rotateBytes) {
        if (rotateBytes <= 0) throw new IllegalArgumentException("rotateBytes must be > 0");
        this.dir = dir;
        this.rotateBytes = rotateBytes;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        openNewestOrCreate();
        retainFrom = segments().get(0);
    }

    @Override
    public synchronized void append(byte[] serializedRecord) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(serializedRecord);
            while (buf.hasRemaining()) ch.write(buf);
            ch.force(true); // fsync: metadata too, so new file appears durable after rotation
            writtenInSegment += serializedRecord.length;
        } catch (IOException e) {
            throw new UncheckedIOException("WAL append failed", e);
        }
    }

    @Override
    public synchronized void rotateIfNeeded() {
        if (writtenInSegment < rotateBytes) return;
        openNext();
    }

    @Override
    public synchronized void checkpoint() {
        Path next = openNext();
        for (Path seg : segments()) {
            if (seg.getFileName().toString().compareTo(retainFrom.getFileName().toString()) >= 0) continue;
            try {
                Files.deleteIfExists(seg);
            } catch (IOException e) {
                throw new UncheckedIOException("failed to delete WAL segment " + seg, e);
            }
        }
        retainFrom = next;
    }

    @Override
    public WalReader openReader() { return new Reader(segments()); }

    @Override
    public synchronized void close() {
        try {
            if (ch != null && ch.isOpen()) ch.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * On startup:
     *  - If there are existing segments, open the newest one, truncate a torn tail,
     *    and position at the end.
     *  - If none, create "00000001.log".
     */
    private void openNewestOrCreate() {
        List<Path> all = segments();
        current = all.isEmpty() ? dir.resolve(segmentName(1)) : all.get(all.size() - 1);
        try {
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            long valid = validPrefix(ch);
            if (valid < ch.size()) {
                log.log(Level.WARNING, "Truncating torn WAL tail in {0}: {1} -> {2} bytes",
                        new Object[]{current.getFileName(), ch.size(), valid});
                ch.truncate(valid);
                ch.force(true);
            }
            writtenInSegment = valid;
            ch.position(valid);
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private Path openNext() {
        try {
            ch.close();
            int idx = Integer.parseInt(current.getFileName().toString().replace(".log", ""));
            current = dir.resolve(segmentName(idx + 1));
            ch = FileChannel.open(current, CREATE, WRITE, READ);
            ch.position(ch.size());
            writtenInSegment = ch.size();
            return current;
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private List<Path> segments() {
        try (Stream<Path> files = Files.list(dir)) {
            return new ArrayList<>(files
                    .filter(p -> p.getFileName().toString().endsWith(".log"))
                    .sorted()
                    .toList());
        } catch (IOException e) { throw new UncheckedIOException(e); }
    }

    private static String segmentName(int index) {
        return String.format("%08d.log", index);
    }

    /** Length of the longest prefix of the channel made only of valid records. */
    private static long validPrefix(FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            byte[] payload = readRecord(ch, pos);
            if (payload == null) return pos;
            pos += RecordCodec.HEADER_BYTES + payload.length;
        }
    }

    /** Payload of the valid record at {@code pos}, or null when missing, truncated or corrupt. */
    private static byte[] readRecord(FileChannel ch, long pos) throws IOException {
        ByteBuffer hdr = ByteBuffer.allocate(RecordCodec.HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        int read = ch.read(hdr, pos);
        if (read < RecordCodec.HEADER_BYTES) return null; // EOF or truncated header at tail
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();
        if (magic != RecordCodec.MAGIC || ver != RecordCodec.VERSION || len < 0) return null;
        if (pos + RecordCodec.HEADER_BYTES + len > ch.size()) return null; // truncated payload
        ByteBuffer payload = ByteBuffer.allocate(len);
        while (payload.hasRemaining()) {
            int r = ch.read(payload, pos + RecordCodec.HEADER_BYTES + payload.position());
            if (r <= 0) return null;
        }
        byte[] bytes = payload.array();
        if (RecordCodec.crc32(bytes) != crc) return null; // bad tail, stop
        return bytes;
    }

    /**
     * Sequential reader for WAL segments used during recovery.
     */
    private static final class Reader implements WalReader {
        private final List<Path> segments;
        private int segIndex = -1;
        private FileChannel ch;
        private long pos = 0;
        private boolean stopped;

        Reader(List<Path> segments) {
            this.segments = segments;
        }

        @Override
        public byte[] next() {
            if (stopped) return null;
            try {
                while (true) {
                    if (ch == null) {
                        if (++segIndex >= segments.size()) return null;
                        ch = FileChannel.open(segments.get(segIndex), READ);
                        pos = 0;
                    }
                    byte[] bytes = readRecord(ch, pos);
                    if (bytes != null) {
                        pos += RecordCodec.HEADER_BYTES + bytes.length;
                        return bytes;
                    }
                    boolean clean = pos == ch.size();
                    ch.close();
                    ch = null;
                    if (!clean) {
                        // A damaged record ends replay; nothing after it is trusted.
                        stopped = true;
                        return null;
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        @Override
        public void close() {
            try {
                if (ch != null) ch.close();
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
    }
}
