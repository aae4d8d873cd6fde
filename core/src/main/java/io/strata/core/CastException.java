// file: src/main/java/io/strata/core/CastException.java
package io.strata.core;

/** A semi-structured value cannot be converted to the requested kind or column type. */
public class CastException extends StrataException {
    public CastException(String message) {
        super(message);
    }

    public CastException(String message, Throwable cause) {
        super(message, cause);
    }
}
