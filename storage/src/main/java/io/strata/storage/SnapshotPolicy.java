// file: src/main/java/io/strata/storage/SnapshotPolicy.java
package io.strata.storage;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Snapshot policy that triggers a full snapshot after every N writes.
 * <p>
 * Simple but effective:
 *  - Bounds worst-case recovery time by limiting WAL replay length.
 *  - Does not consider file size or time.
 */
public final class SnapshotPolicy {
    private final int everyOps;
    private final AtomicInteger sinceLast = new AtomicInteger();

    public SnapshotPolicy(int everyOps) {
        if (everyOps <= 0) throw new IllegalArgumentException("everyOps must be > 0");
        this.everyOps = everyOps;
    }

    /** Call after each successful durable write. Runs {@code takeSnapshot} when the threshold is hit. */
    public void maybeSnapshot(Runnable takeSnapshot) {
        if (sinceLast.incrementAndGet() >= everyOps) {
            takeSnapshot.run();
            sinceLast.set(0);
        }
    }

    public int everyOps() {
        return everyOps;
    }
}
