// file: src/main/java/io/strata/core/RowId.java
package io.strata.core;

import java.util.Objects;

/**
 * Address of one row: the segment that holds it plus its position in that segment.
 * Because segments are immutable, a RowId names the same row for as long as the
 * segment exists.
 */
public record RowId(SegmentId segment, int ordinal) {
    public RowId {
        Objects.requireNonNull(segment, "segment");
        if (ordinal < 0) throw new IllegalArgumentException("ordinal must be >= 0");
    }

    /** Inverse of {@link #toString()}: {@code <segment-hex>:<ordinal>}. */
    public static RowId parse(String text) {
        int colon = text.lastIndexOf(':');
        if (colon < 0) throw new IllegalArgumentException("bad row id: " + text);
        try {
            return new RowId(new SegmentId(text.substring(0, colon)), Integer.parseInt(text.substring(colon + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad row id: " + text, e);
        }
    }

    @Override
    public String toString() {
        return segment.hex() + ":" + ordinal;
    }
}
