// file: src/main/java/io/strata/core/SegmentId.java
package io.strata.core;

import java.util.HexFormat;
import java.util.Objects;

/**
 * Content-derived identifier of a segment: the lowercase hex SHA-256 of the
 * segment's canonical encoding. Equal content always yields an equal id.
 */
public record SegmentId(String hex) {
    public SegmentId {
        Objects.requireNonNull(hex, "hex");
        if (hex.length() != 64 || !hex.chars().allMatch(c -> (c >= '0' && c <= '9') || (c >= 'a' && c <= 'f'))) {
            throw new IllegalArgumentException("segment id must be 64 lowercase hex chars: " + hex);
        }
    }

    public static SegmentId ofDigest(byte[] sha256) {
        if (sha256.length != 32) throw new IllegalArgumentException("expected a 32-byte digest");
        return new SegmentId(HexFormat.of().formatHex(sha256));
    }

    /** First 12 hex chars, for logs. */
    public String shortHex() {
        return hex.substring(0, 12);
    }

    @Override
    public String toString() {
        return hex;
    }
}
