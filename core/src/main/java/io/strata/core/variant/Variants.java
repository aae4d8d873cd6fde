// file: src/main/java/io/strata/core/variant/Variants.java
package io.strata.core.variant;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operations over {@link Variant} trees: path extraction, JSON parsing and rendering,
 * and the small set of semi-structured helpers the query layer needs
 * (OBJECT_KEYS, ARRAY_CONSTRUCT).
 * <p>
 * Parsing and rendering go through Jackson; numbers are read as BigDecimal so
 * no precision is lost on the way in or out.
 */
public final class Variants {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final JsonFactory FACTORY = JsonFactory.builder()
            .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
            .build();

    private Variants() {
        // utility
    }

    /**
     * Descend {@code value} along {@code path}.
     * <p>
     * Total: an absent field, an out-of-range index, or a step into a node that is
     * not the matching container yields {@link Variant#NULL}; nothing is thrown and
     * the source is never modified.
     */
    public static Variant extract(Variant value, VariantPath path) {
        Variant current = value == null ? Variant.NULL : value;
        for (PathElement step : path.elements()) {
            if (current.isNull()) return Variant.NULL;
            if (step instanceof PathElement.Field f) {
                current = current instanceof Variant.Obj o ? o.get(f.name()) : Variant.NULL;
            } else {
                int idx = ((PathElement.Index) step).index();
                if (current instanceof Variant.Arr a && idx >= 0 && idx < a.size()) {
                    current = a.elements().get(idx);
                } else {
                    current = Variant.NULL;
                }
            }
        }
        return current;
    }

    /** Convenience overload taking the text form of the path. */
    public static Variant extract(Variant value, String path) {
        return extract(value, VariantPath.parse(path));
    }

    /**
     * Parse JSON text into a tree.
     *
     * @throws IllegalArgumentException when the text is not a single well-formed JSON value
     */
    public static Variant parse(String text) {
        if (text == null) throw new IllegalArgumentException("text must not be null");
        try {
            JsonNode node = MAPPER.readTree(text);
            if (node == null || node.isMissingNode()) {
                throw new IllegalArgumentException("empty JSON text");
            }
            return fromJsonNode(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse JSON-like text, returning the null variant for null, blank or malformed
     * input instead of failing. Never throws.
     */
    public static Variant safeParse(String text) {
        if (text == null || text.isBlank()) return Variant.NULL;
        try {
            return parse(text);
        } catch (IllegalArgumentException e) {
            return Variant.NULL;
        }
    }

    /** Render a tree as compact JSON text. Object fields keep their insertion order. */
    public static String toJson(Variant value) {
        var out = new StringWriter();
        try (JsonGenerator g = FACTORY.createGenerator(out)) {
            write(g, value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    /** OBJECT_KEYS: the field names of an object as an array of strings; null for other kinds. */
    public static Variant objectKeys(Variant value) {
        if (!(value instanceof Variant.Obj o)) return Variant.NULL;
        var keys = new ArrayList<Variant>(o.fields().size());
        for (String k : o.fields().keySet()) keys.add(new Variant.Str(k));
        return new Variant.Arr(keys);
    }

    /** ARRAY_CONSTRUCT: an array of the given elements, in order. */
    public static Variant.Arr arrayConstruct(Variant... elements) {
        return new Variant.Arr(List.of(elements));
    }

    static Variant fromJsonNode(JsonNode node) {
        switch (node.getNodeType()) {
            case NULL:
            case MISSING:
                return Variant.NULL;
            case BOOLEAN:
                return new Variant.Bool(node.booleanValue());
            case NUMBER:
                return new Variant.Num(node.isIntegralNumber()
                        ? new BigDecimal(node.bigIntegerValue())
                        : node.decimalValue());
            case STRING:
                return new Variant.Str(node.textValue());
            case ARRAY: {
                var elements = new ArrayList<Variant>(node.size());
                for (JsonNode child : node) elements.add(fromJsonNode(child));
                return new Variant.Arr(elements);
            }
            case OBJECT: {
                Map<String, Variant> fields = new LinkedHashMap<>(node.size() * 2);
                for (Iterator<Map.Entry<String, JsonNode>> it = node.fields(); it.hasNext(); ) {
                    var e = it.next();
                    fields.put(e.getKey(), fromJsonNode(e.getValue()));
                }
                return new Variant.Obj(fields);
            }
            default:
                // BINARY / POJO nodes never come out of text parsing.
                throw new IllegalArgumentException("unsupported JSON node type: " + node.getNodeType());
        }
    }

    private static void write(JsonGenerator g, Variant v) throws IOException {
        if (v instanceof Variant.Null) {
            g.writeNull();
        } else if (v instanceof Variant.Bool b) {
            g.writeBoolean(b.value());
        } else if (v instanceof Variant.Num n) {
            g.writeNumber(n.value());
        } else if (v instanceof Variant.Str s) {
            g.writeString(s.value());
        } else if (v instanceof Variant.Arr a) {
            g.writeStartArray();
            for (Variant e : a.elements()) write(g, e);
            g.writeEndArray();
        } else if (v instanceof Variant.Obj o) {
            g.writeStartObject();
            for (var e : o.fields().entrySet()) {
                g.writeFieldName(e.getKey());
                write(g, e.getValue());
            }
            g.writeEndObject();
        }
    }
}
