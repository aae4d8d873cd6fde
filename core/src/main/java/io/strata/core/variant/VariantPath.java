// file: src/main/java/io/strata/core/variant/VariantPath.java
package io.strata.core.variant;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable sequence of field/index steps used to descend into a {@link Variant}.
 * <p>
 * Text form accepted by {@link #parse(String)}:
 * <pre>
 *   CIK                        field
 *   METADATA.ProductOrService  nested field ('.' or ':' separate steps)
 *   METADATA:"Product Name"    quoted field (double quotes, "" escapes a quote)
 *   tickers[0]                 array index
 *   a["odd.key"][2].b          bracketed field name, then index, then field
 * </pre>
 */
public final class VariantPath {

    private static final VariantPath ROOT = new VariantPath(List.of());

    private final List<PathElement> elements;

    private VariantPath(List<PathElement> elements) {
        this.elements = List.copyOf(elements);
    }

    public static VariantPath root() {
        return ROOT;
    }

    public static VariantPath of(List<PathElement> elements) {
        return elements.isEmpty() ? ROOT : new VariantPath(elements);
    }

    /** Path of plain field names, no parsing applied. */
    public static VariantPath fields(String... names) {
        var out = new ArrayList<PathElement>(names.length);
        for (String n : names) out.add(new PathElement.Field(n));
        return of(out);
    }

    public VariantPath field(String name) {
        var out = new ArrayList<>(elements);
        out.add(new PathElement.Field(name));
        return new VariantPath(out);
    }

    public VariantPath index(int index) {
        var out = new ArrayList<>(elements);
        out.add(new PathElement.Index(index));
        return new VariantPath(out);
    }

    public List<PathElement> elements() {
        return elements;
    }

    public boolean isRoot() {
        return elements.isEmpty();
    }

    /**
     * Parse the text form.
     *
     * @throws IllegalArgumentException on malformed text (unterminated quote or bracket,
     *                                  empty step, non-numeric index)
     */
    public static VariantPath parse(String text) {
        if (text == null) throw new IllegalArgumentException("path must not be null");
        var out = new ArrayList<PathElement>();
        int i = 0;
        int n = text.length();
        boolean expectStep = true;

        while (i < n) {
            char c = text.charAt(i);
            if (c == '[') {
                int close = findClosingBracket(text, i);
                String inner = text.substring(i + 1, close).trim();
                if (inner.startsWith("\"") || inner.startsWith("'")) {
                    out.add(new PathElement.Field(unquote(inner, text)));
                } else {
                    try {
                        out.add(new PathElement.Index(Integer.parseInt(inner)));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("bad array index '" + inner + "' in path: " + text);
                    }
                }
                i = close + 1;
                expectStep = false;
            } else if (c == '.' || c == ':') {
                if (expectStep) throw new IllegalArgumentException("empty step in path: " + text);
                i++;
                expectStep = true;
                if (i == n) throw new IllegalArgumentException("path ends with a separator: " + text);
            } else if (c == '"') {
                if (!expectStep) throw new IllegalArgumentException("missing separator in path: " + text);
                var sb = new StringBuilder();
                i++;
                boolean closed = false;
                while (i < n) {
                    char q = text.charAt(i);
                    if (q == '"') {
                        if (i + 1 < n && text.charAt(i + 1) == '"') {
                            sb.append('"');
                            i += 2;
                            continue;
                        }
                        closed = true;
                        i++;
                        break;
                    }
                    sb.append(q);
                    i++;
                }
                if (!closed) throw new IllegalArgumentException("unterminated quote in path: " + text);
                out.add(new PathElement.Field(sb.toString()));
                expectStep = false;
            } else {
                if (!expectStep) throw new IllegalArgumentException("missing separator in path: " + text);
                int start = i;
                while (i < n && "[.:\"".indexOf(text.charAt(i)) < 0) i++;
                String name = text.substring(start, i).trim();
                if (name.isEmpty()) throw new IllegalArgumentException("empty step in path: " + text);
                out.add(new PathElement.Field(name));
                expectStep = false;
            }
        }
        return of(out);
    }

    private static int findClosingBracket(String text, int open) {
        char quote = 0;
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == ']') {
                return i;
            }
        }
        throw new IllegalArgumentException("unterminated bracket in path: " + text);
    }

    private static String unquote(String inner, String text) {
        char q = inner.charAt(0);
        if (inner.length() < 2 || inner.charAt(inner.length() - 1) != q) {
            throw new IllegalArgumentException("unterminated quote in path: " + text);
        }
        return inner.substring(1, inner.length() - 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VariantPath other)) return false;
        return elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (PathElement e : elements) {
            if (e instanceof PathElement.Field f) {
                if (sb.length() > 0) sb.append('.');
                sb.append(f.name());
            } else {
                sb.append(e);
            }
        }
        return sb.toString();
    }
}
