// file: src/main/java/io/strata/core/ConflictException.java
package io.strata.core;

/**
 * A write raced another writer: it was built against a head that is no longer current
 * (or a name that is already taken). Recoverable by re-reading and retrying; the store
 * never retries on the caller's behalf.
 */
public class ConflictException extends StrataException {
    public ConflictException(String message) {
        super(message);
    }
}
