// file: src/main/java/io/strata/core/OutOfRetentionException.java
package io.strata.core;

/** A time-travel locator points before the history the table still retains. Terminal. */
public class OutOfRetentionException extends StrataException {
    public OutOfRetentionException(String message) {
        super(message);
    }
}
