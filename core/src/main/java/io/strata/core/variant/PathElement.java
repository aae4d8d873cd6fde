// file: src/main/java/io/strata/core/variant/PathElement.java
package io.strata.core.variant;

import java.util.Objects;

/**
 * One step of a {@link VariantPath}: either an object field or an array index.
 */
public sealed interface PathElement permits PathElement.Field, PathElement.Index {

    record Field(String name) implements PathElement {
        public Field {
            Objects.requireNonNull(name, "name");
        }

        @Override public String toString() { return name; }
    }

    record Index(int index) implements PathElement {
        @Override public String toString() { return "[" + index + "]"; }
    }
}
