// file: src/main/java/io/strata/engine/projection/ColumnSpec.java
package io.strata.engine.projection;

import io.strata.core.variant.Variant;
import io.strata.core.variant.VariantPath;
import io.strata.core.variant.Variants;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One projected column: where to read (a path into the row), what to call it,
 * and which type to convert to.
 * <p>
 * When {@code tryParseJson} is set the extracted value, if it is a string, is first
 * parsed as JSON text; malformed text becomes null rather than an error.
 */
public record ColumnSpec(String alias, VariantPath path, ColumnType type, boolean tryParseJson) {

    private static final Pattern CAST = Pattern.compile("(?s)(.+?)::\\s*(\\w+)\\s+AS\\s+(\\S+)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRY_PARSE = Pattern.compile("(?s)\\s*TRY_PARSE_JSON\\s*\\((.+)\\)\\s+AS\\s+(\\S+)\\s*",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PLAIN = Pattern.compile("(?s)(.+?)\\s+AS\\s+(\\S+)\\s*", Pattern.CASE_INSENSITIVE);

    public ColumnSpec {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(type, "type");
        if (alias.isBlank()) throw new IllegalArgumentException("alias must not be blank");
    }

    public static ColumnSpec of(String alias, String path, ColumnType type) {
        return new ColumnSpec(alias, VariantPath.parse(path), type, false);
    }

    /** {@code TRY_PARSE_JSON(path) AS alias}. */
    public static ColumnSpec tryParseJson(String alias, String path) {
        return new ColumnSpec(alias, VariantPath.parse(path), ColumnType.VARIANT, true);
    }

    /**
     * Parse a select-list item:
     * <pre>
     *   v:EIN::int AS ein
     *   TRY_PARSE_JSON(v:METADATA) AS metadata
     *   v:METADATA AS metadata            (VARIANT)
     * </pre>
     */
    public static ColumnSpec parse(String text) {
        Matcher m = TRY_PARSE.matcher(text);
        if (m.matches()) return tryParseJson(m.group(2), m.group(1).trim());
        m = CAST.matcher(text);
        if (m.matches()) return of(m.group(3), m.group(1).trim(), ColumnType.fromSqlName(m.group(2)));
        m = PLAIN.matcher(text);
        if (m.matches()) return of(m.group(2), m.group(1).trim(), ColumnType.VARIANT);
        throw new IllegalArgumentException("cannot parse column '" + text + "'; expected <path>[::type] AS <alias>");
    }

    /** Extract and convert this column from a row tree. */
    public Object project(Variant row) {
        Variant v = Variants.extract(row, path);
        if (tryParseJson && v instanceof Variant.Str s) v = Variants.safeParse(s.value());
        return type.convert(v);
    }

    public String normalizedAlias() {
        return alias.toUpperCase(Locale.ROOT);
    }
}
