// file: src/main/java/io/strata/core/TableState.java
package io.strata.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * One immutable version of a table (a commit in its version chain).
 * <p>
 * Fields:
 *  - stateId:       catalog-wide logical clock; strictly increases along a chain.
 *  - parentStateId: the state this one was built on, or null for a chain root
 *                   (table creation or clone).
 *  - segments:      every segment whose rows are visible in this state, in read order.
 *  - addedSegments: the subset of {@code segments} this write introduced.
 *  - tombstones:    rows of the parent this write logically deleted. Segments holding
 *                   a tombstoned row are dropped from {@code segments} and their
 *                   surviving rows re-written into an added segment.
 *  - operation:     the kind of write.
 *  - createdAt:     commit instant; never decreases along a chain.
 *  - statementRef:  opaque id of the statement that produced the state.
 */
public record TableState(
        long stateId,
        Long parentStateId,
        Set<SegmentId> segments,
        Set<SegmentId> addedSegments,
        Set<RowId> tombstones,
        OperationKind operation,
        Instant createdAt,
        String statementRef
) {
    public TableState {
        if (stateId <= 0) throw new IllegalArgumentException("stateId must be > 0");
        if (parentStateId != null && parentStateId >= stateId) {
            throw new IllegalArgumentException("parentStateId must precede stateId");
        }
        segments = ordered(segments);
        addedSegments = ordered(addedSegments);
        tombstones = ordered(tombstones);
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(statementRef, "statementRef");
    }

    public boolean isRoot() {
        return parentStateId == null;
    }

    private static <T> Set<T> ordered(Set<T> in) {
        Objects.requireNonNull(in, "set");
        return Collections.unmodifiableSet(new LinkedHashSet<>(in));
    }
}
