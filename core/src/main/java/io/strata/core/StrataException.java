// file: src/main/java/io/strata/core/StrataException.java
package io.strata.core;

/**
 * Root of the store's error taxonomy. All subclasses are unchecked and are
 * surfaced to the caller unmodified; nothing in the store retries on them.
 */
public class StrataException extends RuntimeException {
    public StrataException(String message) {
        super(message);
    }

    public StrataException(String message, Throwable cause) {
        super(message, cause);
    }
}
