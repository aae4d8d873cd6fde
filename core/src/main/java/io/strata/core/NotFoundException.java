// file: src/main/java/io/strata/core/NotFoundException.java
package io.strata.core;

/** Unknown table, segment or state, or an undrop attempted outside the retention window. */
public class NotFoundException extends StrataException {
    public NotFoundException(String message) {
        super(message);
    }
}
