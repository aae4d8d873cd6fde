// file: src/main/java/io/strata/core/variant/Variant.java
package io.strata.core.variant;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable semi-structured value: a tagged tree of null, boolean, number,
 * string, array and object nodes.
 * <p>
 * Invariants:
 *  - Every node is immutable; containers hold defensive copies.
 *  - Objects keep insertion order (it is part of the canonical encoding).
 *  - Numbers are arbitrary-precision decimals normalized by stripping trailing
 *    zeros, so 1 and 1.0 compare equal.
 *  - Java null never appears inside a tree; absence is {@link #NULL}.
 */
public sealed interface Variant
        permits Variant.Null, Variant.Bool, Variant.Num, Variant.Str, Variant.Arr, Variant.Obj {

    /** The null variant. */
    Null NULL = new Null();

    VariantKind kind();

    default boolean isNull() {
        return kind() == VariantKind.NULL;
    }

    static Variant of(boolean value) {
        return new Bool(value);
    }

    static Variant of(long value) {
        return new Num(BigDecimal.valueOf(value));
    }

    static Variant of(BigDecimal value) {
        return value == null ? NULL : new Num(value);
    }

    static Variant of(String value) {
        return value == null ? NULL : new Str(value);
    }

    static Arr array(List<? extends Variant> elements) {
        return new Arr(List.copyOf(elements));
    }

    static Obj object(Map<String, ? extends Variant> fields) {
        return new Obj(new LinkedHashMap<>(fields));
    }

    record Null() implements Variant {
        @Override public VariantKind kind() { return VariantKind.NULL; }
        @Override public String toString() { return "null"; }
    }

    record Bool(boolean value) implements Variant {
        @Override public VariantKind kind() { return VariantKind.BOOLEAN; }
        @Override public String toString() { return Boolean.toString(value); }
    }

    /** A number whose scale, after stripping trailing zeros, lies within {@code ±MAX_SCALE}. */
    record Num(BigDecimal value) implements Variant {
        public static final int MAX_SCALE = 1024;

        public Num {
            Objects.requireNonNull(value, "value");
            value = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
            if (!scaleInRange(value)) {
                throw new IllegalArgumentException("number out of range: scale " + value.scale());
            }
        }

        /** True when {@code value} renders as plain decimal text of bounded length. */
        public static boolean scaleInRange(BigDecimal value) {
            BigDecimal v = value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
            return v.scale() <= MAX_SCALE && v.scale() >= -MAX_SCALE;
        }

        @Override public VariantKind kind() { return VariantKind.NUMBER; }
        @Override public String toString() { return value.toPlainString(); }
    }

    record Str(String value) implements Variant {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override public VariantKind kind() { return VariantKind.STRING; }
        @Override public String toString() { return Variants.toJson(this); }
    }

    record Arr(List<Variant> elements) implements Variant {
        public Arr {
            elements = List.copyOf(elements);
        }

        public int size() { return elements.size(); }

        @Override public VariantKind kind() { return VariantKind.ARRAY; }
        @Override public String toString() { return Variants.toJson(this); }
    }

    record Obj(Map<String, Variant> fields) implements Variant {
        public Obj {
            var copy = new LinkedHashMap<String, Variant>(fields.size() * 2);
            for (var e : fields.entrySet()) {
                copy.put(Objects.requireNonNull(e.getKey(), "field name"),
                        Objects.requireNonNull(e.getValue(), "field value"));
            }
            fields = Collections.unmodifiableMap(copy);
        }

        /** Field value, or the null variant when absent. */
        public Variant get(String name) {
            return fields.getOrDefault(name, NULL);
        }

        @Override public VariantKind kind() { return VariantKind.OBJECT; }
        @Override public String toString() { return Variants.toJson(this); }
    }
}
