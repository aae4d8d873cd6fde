// file: src/main/java/io/strata/engine/projection/ColumnType.java
package io.strata.engine.projection;

import io.strata.core.CastException;
import io.strata.core.variant.Variant;
import io.strata.core.variant.VariantCaster;
import io.strata.core.variant.VariantKind;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Target types of a projected column ({@code path::type}) and the Java value each produces.
 * <p>
 * The null variant projects to Java null for every type.
 */
public enum ColumnType {
    /** the extracted tree itself ({@link Variant}) */
    VARIANT,
    /** {@link String}; scalars via their text, containers as JSON */
    STRING,
    /** {@link BigDecimal} */
    NUMBER,
    /** {@link Long}, rounded half-up */
    INTEGER,
    /** {@link Double} */
    DOUBLE,
    /** {@link Boolean}, only from booleans */
    BOOLEAN,
    /** {@link LocalDate} from ISO-style text; time of day is dropped */
    DATE,
    /** {@link LocalDateTime} from ISO-style text, 'T' or a space between date and time; offsets go to UTC */
    TIMESTAMP;

    /** Resolve a SQL type name, accepting common aliases (INT, VARCHAR, FLOAT, ...). */
    public static ColumnType fromSqlName(String name) {
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case "VARIANT": return VARIANT;
            case "STRING": case "VARCHAR": case "TEXT": return STRING;
            case "NUMBER": case "DECIMAL": case "NUMERIC": return NUMBER;
            case "INT": case "INTEGER": case "BIGINT": return INTEGER;
            case "DOUBLE": case "FLOAT": case "REAL": return DOUBLE;
            case "BOOLEAN": return BOOLEAN;
            case "DATE": return DATE;
            case "TIMESTAMP": case "TIMESTAMP_NTZ": case "DATETIME": return TIMESTAMP;
            default: throw new IllegalArgumentException("unknown column type " + name);
        }
    }

    /**
     * @throws CastException when the value cannot be converted
     */
    public Object convert(Variant value) {
        if (value == null || value.isNull()) return null;
        switch (this) {
            case VARIANT:
                return value;
            case STRING:
                return ((Variant.Str) VariantCaster.cast(value, VariantKind.STRING)).value();
            case NUMBER:
                return number(value);
            case INTEGER:
                try {
                    return number(value).setScale(0, RoundingMode.HALF_UP).longValueExact();
                } catch (ArithmeticException e) {
                    throw new CastException("value " + value + " is out of INTEGER range", e);
                }
            case DOUBLE:
                return number(value).doubleValue();
            case BOOLEAN:
                return ((Variant.Bool) VariantCaster.cast(value, VariantKind.BOOLEAN)).value();
            case DATE:
                return timestamp(value).toLocalDate();
            case TIMESTAMP:
                return timestamp(value);
            default:
                throw new IllegalStateException("unhandled type " + this);
        }
    }

    private static BigDecimal number(Variant value) {
        return ((Variant.Num) VariantCaster.cast(value, VariantKind.NUMBER)).value();
    }

    private static LocalDateTime timestamp(Variant value) {
        if (!(value instanceof Variant.Str s)) {
            throw new CastException("cannot cast " + value.kind() + " to a date or timestamp");
        }
        String text = s.value().trim();
        String iso = text.length() > 10 && text.charAt(10) == ' '
                ? text.substring(0, 10) + 'T' + text.substring(11)
                : text;
        try {
            if (iso.length() == 10) return LocalDate.parse(iso).atStartOfDay();
            try {
                return LocalDateTime.parse(iso);
            } catch (DateTimeParseException local) {
                return OffsetDateTime.parse(iso).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            }
        } catch (DateTimeParseException e) {
            throw new CastException("cannot cast '" + text + "' to a date or timestamp", e);
        }
    }
}
