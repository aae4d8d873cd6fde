// file: src/main/java/io/strata/core/PrivilegeDeniedException.java
package io.strata.core;

/** The session's role does not hold the privilege an operation requires. */
public class PrivilegeDeniedException extends StrataException {
    public PrivilegeDeniedException(String message) {
        super(message);
    }
}
