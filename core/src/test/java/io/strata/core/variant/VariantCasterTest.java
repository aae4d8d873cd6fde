// file: src/test/java/io/strata/core/variant/VariantCasterTest.java
package io.strata.core.variant;

import io.strata.core.CastException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class VariantCasterTest {

    @Test
    void string_to_number_uses_standard_numeric_grammar() {
        assertEquals(Variant.of(42L), VariantCaster.cast(Variant.of(" 42 "), VariantKind.NUMBER));
        assertEquals(Variant.of(new BigDecimal("-1.5E+3")), VariantCaster.cast(Variant.of("-1.5e3"), VariantKind.NUMBER));
        assertThrows(CastException.class, () -> VariantCaster.cast(Variant.of("12abc"), VariantKind.NUMBER));
        assertThrows(CastException.class, () -> VariantCaster.cast(Variant.of(""), VariantKind.NUMBER));
        assertThrows(CastException.class, () -> VariantCaster.cast(Variant.of("1e999999999"), VariantKind.NUMBER));
    }

    @Test
    void number_to_string_is_exact_decimal() {
        assertEquals(Variant.of("0.000001"), VariantCaster.cast(Variant.of(new BigDecimal("1E-6")), VariantKind.STRING));
        assertEquals(Variant.of("1500"), VariantCaster.cast(Variant.of(new BigDecimal("1.5E+3")), VariantKind.STRING));
    }

    @Test
    void boolean_target_only_accepts_boolean_source() {
        assertEquals(Variant.of(true), VariantCaster.cast(Variant.of(true), VariantKind.BOOLEAN));
        assertThrows(CastException.class, () -> VariantCaster.cast(Variant.of("true"), VariantKind.BOOLEAN));
        assertThrows(CastException.class, () -> VariantCaster.cast(Variant.of(1L), VariantKind.BOOLEAN));
    }

    @Test
    void null_casts_to_null_for_every_kind() {
        for (VariantKind k : VariantKind.values()) {
            assertTrue(VariantCaster.cast(Variant.NULL, k).isNull());
        }
    }

    @Test
    void containers_render_as_json_text_but_do_not_cross_kinds() {
        Variant arr = Variants.parse("[1,\"x\"]");
        assertEquals(Variant.of("[1,\"x\"]"), VariantCaster.cast(arr, VariantKind.STRING));
        assertThrows(CastException.class, () -> VariantCaster.cast(arr, VariantKind.OBJECT));
        assertThrows(CastException.class, () -> VariantCaster.cast(Variant.of("{}"), VariantKind.OBJECT));
        assertThrows(CastException.class, () -> VariantCaster.cast(arr, VariantKind.NUMBER));
    }
}
