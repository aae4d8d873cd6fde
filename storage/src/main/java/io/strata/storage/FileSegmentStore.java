// file: src/main/java/io/strata/storage/FileSegmentStore.java
package io.strata.storage;

import io.strata.core.NotFoundException;
import io.strata.core.Row;
import io.strata.core.SegmentId;
import io.strata.core.variant.Variant;
import io.strata.core.variant.Variants;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Segment store keeping one file per segment, "&lt;sha256-hex&gt;.seg".
 * <p>
 * File format: a single record frame (see {@link RecordCodec#frame(byte[])}) whose
 * payload is the canonical JSON array of the segment's rows. The id is the SHA-256
 * of that payload, so identical row lists always map to the same file.
 * <p>
 * Writes go to "&lt;hex&gt;.seg.tmp", are fsynced, then moved into place with ATOMIC_MOVE.
 * All segments are indexed in memory on open; reference counts start at zero and are
 * re-established by the catalog during its recovery. The grace period of a loaded
 * segment starts when the store is opened.
 */
public final class FileSegmentStore implements SegmentStore {
    private static final Logger log = Logger.getLogger(FileSegmentStore.class.getName());
    private static final String SUFFIX = ".seg";

    private final Path dir;
    private final Duration grace;
    private final Clock clock;
    private final Map<SegmentId, Entry> index = new ConcurrentHashMap<>();

    private static final class Entry {
        final List<Row> rows;
        volatile Instant writtenAt;
        final AtomicInteger refs = new AtomicInteger();

        Entry(List<Row> rows, Instant writtenAt) {
            this.rows = rows;
            this.writtenAt = writtenAt;
        }
    }

    public FileSegmentStore(Path dir) {
        this(dir, Duration.ofMinutes(5), Clock.systemUTC());
    }

    /**
     * @param grace minimum age before an unreferenced segment may be reclaimed; covers
     *              writes whose segments are stored but whose state is not yet appended
     */
    public FileSegmentStore(Path dir, Duration grace, Clock clock) {
        if (grace.isNegative()) throw new IllegalArgumentException("grace must be >= 0");
        this.dir = dir;
        this.grace = grace;
        this.clock = clock;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new UncheckedIOException(e); }
        loadAll();
    }

    @Override
    public SegmentId put(List<Row> rows) {
        if (rows == null || rows.isEmpty()) throw new IllegalArgumentException("a segment needs at least one row");
        byte[] payload = canonical(rows);
        SegmentId id = SegmentId.ofDigest(sha256(payload));
        index.compute(id, (k, e) -> {
            if (e != null) {
                // same content again: it is about to be referenced, so restart its grace period
                e.writtenAt = clock.instant();
                return e;
            }
            write(k, payload);
            return new Entry(List.copyOf(rows), clock.instant());
        });
        return id;
    }

    @Override
    public List<Row> get(SegmentId id) {
        return entry(id).rows;
    }

    @Override
    public boolean contains(SegmentId id) {
        return index.containsKey(id);
    }

    @Override
    public void retain(SegmentId id) {
        entry(id).refs.incrementAndGet();
    }

    @Override
    public void release(SegmentId id) {
        Entry e = index.get(id);
        if (e == null) {
            log.log(Level.WARNING, "release of unknown segment {0}", id.shortHex());
            return;
        }
        if (e.refs.decrementAndGet() < 0) {
            e.refs.set(0);
            throw new IllegalStateException("segment " + id.shortHex() + " released more often than retained");
        }
    }

    @Override
    public int refCount(SegmentId id) {
        Entry e = index.get(id);
        return e == null ? 0 : e.refs.get();
    }

    @Override
    public int segmentCount() {
        return index.size();
    }

    @Override
    public int reclaim() {
        Instant cutoff = clock.instant().minus(grace);
        int deleted = 0;
        for (SegmentId id : List.copyOf(index.keySet())) {
            boolean[] removed = {false};
            index.computeIfPresent(id, (k, e) -> {
                if (e.refs.get() > 0 || e.writtenAt.isAfter(cutoff)) return e;
                try {
                    Files.deleteIfExists(fileOf(k));
                } catch (IOException ex) {
                    throw new UncheckedIOException("failed to delete segment " + k.shortHex(), ex);
                }
                removed[0] = true;
                return null;
            });
            if (removed[0]) deleted++;
        }
        if (deleted > 0) log.log(Level.INFO, "Reclaimed {0} unreferenced segments", deleted);
        return deleted;
    }

    // ----------------- helpers -----------------

    private Entry entry(SegmentId id) {
        Entry e = index.get(id);
        if (e == null) throw new NotFoundException("segment " + id.shortHex() + " not found");
        return e;
    }

    private Path fileOf(SegmentId id) {
        return dir.resolve(id.hex() + SUFFIX);
    }

    private void write(SegmentId id, byte[] payload) {
        Path dst = fileOf(id);
        if (Files.exists(dst)) return;
        Path tmp = dir.resolve(id.hex() + SUFFIX + ".tmp");
        try {
            Files.write(tmp, RecordCodec.frame(payload), StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE, StandardOpenOption.SYNC);
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write segment " + id.shortHex(), e);
        }
    }

    private void loadAll() {
        List<Path> files;
        try (Stream<Path> s = Files.list(dir)) {
            files = s.toList();
        } catch (IOException e) { throw new UncheckedIOException(e); }

        for (Path p : files) {
            String name = p.getFileName().toString();
            try {
                if (name.endsWith(".tmp")) {
                    Files.deleteIfExists(p); // leftover of an interrupted write
                    continue;
                }
                if (!name.endsWith(SUFFIX)) continue;
                SegmentId id = new SegmentId(name.substring(0, name.length() - SUFFIX.length()));
                byte[] payload = RecordCodec.unframe(Files.readAllBytes(p));
                if (payload == null || !id.equals(SegmentId.ofDigest(sha256(payload)))) {
                    log.log(Level.WARNING, "Ignoring corrupt segment file {0}", name);
                    continue;
                }
                index.put(id, new Entry(decode(payload), clock.instant()));
            } catch (IOException e) {
                throw new UncheckedIOException("failed to load segment " + name, e);
            }
        }
        log.log(Level.INFO, "Loaded {0} segments from {1}", new Object[]{index.size(), dir});
    }

    static byte[] canonical(List<Row> rows) {
        String json = rows.stream().map(Row::toString).collect(Collectors.joining(",", "[", "]"));
        return json.getBytes(StandardCharsets.UTF_8);
    }

    private static List<Row> decode(byte[] payload) {
        Variant v = Variants.parse(new String(payload, StandardCharsets.UTF_8));
        if (!(v instanceof Variant.Arr arr)) throw new IllegalStateException("segment payload is not an array");
        List<Row> rows = new ArrayList<>(arr.size());
        for (Variant el : arr.elements()) {
            if (!(el instanceof Variant.Obj o)) throw new IllegalStateException("segment row is not an object");
            rows.add(Row.of(o));
        }
        return List.copyOf(rows);
    }

    private static byte[] sha256(byte[] bytes) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(bytes);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
