// file: src/main/java/io/strata/storage/SegmentStore.java
package io.strata.storage;

import io.strata.core.Row;
import io.strata.core.RowId;
import io.strata.core.SegmentId;
import io.strata.core.StoredRow;
import io.strata.core.TableState;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable, content-addressed blocks of rows.
 * <p>
 * Contract:
 *  - put() derives the id from the rows' content, so storing the same rows twice
 *    returns the same id and keeps a single copy.
 *  - Segments are never edited. A segment is physically removed only by
 *    {@link #reclaim()}, and only once its reference count is zero.
 *  - Reference counts are owned by the catalog: one reference per retained
 *    table state that lists the segment.
 */
public interface SegmentStore {

    /**
     * Store rows as one segment.
     *
     * @throws IllegalArgumentException if {@code rows} is empty
     */
    SegmentId put(List<Row> rows);

    /**
     * Rows of a segment, in stored order.
     *
     * @throws io.strata.core.NotFoundException if unknown or already reclaimed
     */
    List<Row> get(SegmentId id);

    boolean contains(SegmentId id);

    void retain(SegmentId id);

    void release(SegmentId id);

    int refCount(SegmentId id);

    /** Number of distinct segments currently stored. */
    int segmentCount();

    /**
     * Delete every unreferenced segment that is older than the store's grace period.
     *
     * @return how many segments were deleted
     */
    int reclaim();

    /** Every visible row of {@code state}, addressed by row id. */
    default List<StoredRow> scan(TableState state) {
        List<StoredRow> out = new ArrayList<>();
        for (SegmentId seg : state.segments()) {
            List<Row> rows = get(seg);
            for (int i = 0; i < rows.size(); i++) {
                out.add(new StoredRow(new RowId(seg, i), rows.get(i)));
            }
        }
        return out;
    }
}
