// file: src/main/java/io/strata/storage/Snapshotter.java
package io.strata.storage;

/**
 * Snapshot abstraction to bound recovery time.
 * <p>
 * A snapshot is a full image of a journaled state machine taken right after the
 * record with sequence number {@code lsn} was applied. On restart:
 *  - we load the latest snapshot, then
 *  - replay WAL records with a higher sequence number.
 */
public interface Snapshotter {

    /**
     * Persist a full image.
     *
     * @param lsn   sequence number of the last record the image includes
     * @param image serialized state
     * @return snapshot identifier (e.g., filename/path).
     */
    String writeSnapshot(long lsn, byte[] image);

    /** Load the latest intact snapshot, or null when there is none. */
    LoadedSnapshot loadLatest();

    /** Simple holder for snapshot id, its sequence number and its image */
    record LoadedSnapshot(String id, long lsn, byte[] image) {}
}
