// file: src/main/java/io/strata/storage/Journal.java
package io.strata.storage;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Durable log of state-machine records: WAL for every mutation, periodic full
 * snapshots to bound replay.
 * <p>
 * Write path (caller holds its own write lock):
 *  1) {@link #append(String, byte[])} frames the record with the next sequence number,
 *     appends and fsyncs it.
 *  2) the caller applies the record to its in-memory state.
 *  3) {@link #afterApply(Replica)} rotates the WAL if needed and maybe snapshots.
 * <p>
 * Recovery ({@link #recover(Replica)}):
 *  1) Seed the replica from the latest snapshot (if present).
 *  2) Replay WAL records in order, skipping any whose sequence number is not
 *     above the last applied one (already in the snapshot, or a duplicate).
 *     A record that skips ahead of the next expected sequence number fails
 *     recovery: the WAL no longer covers the gap after the loaded snapshot.
 */
public final class Journal implements AutoCloseable {
    private static final Logger log = Logger.getLogger(Journal.class.getName());

    /** The state machine a journal persists. */
    public interface Replica {

        /** Apply one record. Must be deterministic: replay calls it with the same inputs. */
        void apply(String kind, byte[] body);

        /** Serialize the complete current state. */
        byte[] image();

        /** Replace the current state with a previously serialized image. */
        void restore(byte[] image);
    }

    private final Wal wal;
    private final Snapshotter snaps;
    private final SnapshotPolicy policy;
    private long lastLsn;

    public Journal(Wal wal, Snapshotter snaps, SnapshotPolicy policy) {
        this.wal = Objects.requireNonNull(wal, "wal");
        this.snaps = Objects.requireNonNull(snaps, "snaps");
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /** Rebuild {@code replica} from disk. Call once, before any append. */
    public synchronized void recover(Replica replica) {
        Snapshotter.LoadedSnapshot loaded = snaps.loadLatest();
        if (loaded != null) {
            replica.restore(loaded.image());
            lastLsn = loaded.lsn();
        }

        int replayed = 0;
        int skipped = 0;
        try (Wal.WalReader r = wal.openReader()) {
            for (byte[] payload; (payload = r.next()) != null; ) {
                RecordCodec.LogRecord rec = RecordCodec.decode(payload);
                if (rec.lsn() <= lastLsn) {
                    skipped++;
                    continue;
                }
                if (rec.lsn() != lastLsn + 1) {
                    throw new IllegalStateException("WAL gap: expected lsn " + (lastLsn + 1)
                            + " but found " + rec.lsn());
                }
                replica.apply(rec.kind(), rec.body());
                lastLsn = rec.lsn();
                replayed++;
            }
        } catch (RuntimeException e) {
            throw new IllegalStateException("Recovery failed after lsn " + lastLsn, e);
        }
        log.log(Level.INFO, "Recovered journal: snapshot={0}, replayed={1}, skipped={2}, lsn={3}",
                new Object[]{loaded == null ? "none" : loaded.id(), replayed, skipped, lastLsn});
    }

    /** Durably append one record and return its sequence number. */
    public synchronized long append(String kind, byte[] body) {
        long lsn = lastLsn + 1;
        wal.append(RecordCodec.encode(lsn, kind, body));
        lastLsn = lsn;
        return lsn;
    }

    /** Housekeeping after the caller applied the record it just appended. */
    public synchronized void afterApply(Replica replica) {
        wal.rotateIfNeeded();
        policy.maybeSnapshot(() -> snapshot(replica));
    }

    /** Write a full snapshot now and drop the WAL segments older than the previous snapshot. */
    public synchronized void snapshot(Replica replica) {
        snaps.writeSnapshot(lastLsn, replica.image());
        wal.checkpoint();
    }

    public synchronized long lastLsn() {
        return lastLsn;
    }

    @Override
    public void close() {
        wal.close();
    }
}
