// file: src/main/java/io/strata/core/variant/VariantCaster.java
package io.strata.core.variant;

import io.strata.core.CastException;

import java.math.BigDecimal;

/**
 * Conversions between variant kinds.
 * <p>
 * Rules:
 *  - null casts to null for every target kind.
 *  - same kind is the identity.
 *  - STRING target: numbers render as exact plain decimals, booleans as true/false,
 *    arrays and objects as their JSON text.
 *  - NUMBER target: strings parse with the standard numeric grammar (sign, digits,
 *    fraction, exponent; surrounding whitespace ignored).
 *  - BOOLEAN, ARRAY and OBJECT targets accept only their own kind.
 *  - everything else is a {@link CastException}.
 */
public final class VariantCaster {

    private VariantCaster() {
        // utility
    }

    public static Variant cast(Variant value, VariantKind target) {
        if (value == null || value.isNull()) return Variant.NULL;
        if (value.kind() == target) return value;

        switch (target) {
            case STRING:
                if (value instanceof Variant.Num n) return new Variant.Str(n.value().toPlainString());
                if (value instanceof Variant.Bool b) return new Variant.Str(Boolean.toString(b.value()));
                return new Variant.Str(Variants.toJson(value));
            case NUMBER:
                if (value instanceof Variant.Str s) return new Variant.Num(parseNumber(s.value()));
                throw incompatible(value, target);
            default:
                throw incompatible(value, target);
        }
    }

    /** Parse a numeric string, rejecting anything BigDecimal's grammar rejects. */
    public static BigDecimal parseNumber(String text) {
        String t = text.trim();
        if (t.isEmpty()) throw new CastException("cannot cast empty string to NUMBER");
        BigDecimal d;
        try {
            d = new BigDecimal(t);
        } catch (NumberFormatException e) {
            throw new CastException("cannot cast '" + text + "' to NUMBER", e);
        }
        if (!Variant.Num.scaleInRange(d)) throw new CastException("NUMBER out of range: '" + text + "'");
        return d;
    }

    private static CastException incompatible(Variant value, VariantKind target) {
        return new CastException("cannot cast " + value.kind() + " to " + target);
    }
}
