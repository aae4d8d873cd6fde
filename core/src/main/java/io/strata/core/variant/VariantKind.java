// file: src/main/java/io/strata/core/variant/VariantKind.java
package io.strata.core.variant;

/**
 * The tags a {@link Variant} can carry.
 */
public enum VariantKind {
    NULL, BOOLEAN, NUMBER, STRING, ARRAY, OBJECT;

    /** True for ARRAY and OBJECT, the kinds a path can descend into. */
    public boolean isContainer() {
        return this == ARRAY || this == OBJECT;
    }
}
