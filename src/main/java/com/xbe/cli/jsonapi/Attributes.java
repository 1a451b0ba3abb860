package com.xbe.cli.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lenient, total getters over a resource's attribute map.
 *
 * <p>The backend returns some numeric-looking attributes as JSON numbers on one endpoint and as
 * strings on another. None of these getters fail: absent keys, JSON nulls and unexpected types all
 * map to a usable default.
 */
public final class Attributes {
    private Attributes() {}

    /**
     * Missing or null → {@code ""}; strings as-is; other scalars in their canonical text form
     * ({@code 42}, {@code 1.5}, {@code true}); arrays and objects as compact JSON.
     */
    public static String asString(Map<String, JsonNode> attrs, String key) {
        return asString(value(attrs, key));
    }

    /**
     * {@code true} only for a JSON {@code true}.
     */
    public static boolean asBool(Map<String, JsonNode> attrs, String key) {
        var node = value(attrs, key);
        return node.isBoolean() && node.booleanValue();
    }

    /**
     * Missing or null → empty list; arrays element-wise (null elements skipped); any other value
     * becomes a one-element list.
     */
    public static List<String> asStringSequence(Map<String, JsonNode> attrs, String key) {
        var node = value(attrs, key);
        var values = new ArrayList<String>();
        if (node.isMissingNode() || node.isNull()) {
            return values;
        }
        if (node.isArray()) {
            for (var element : node) {
                if (element != null && !element.isNull()) {
                    values.add(asString(element));
                }
            }
            return values;
        }
        values.add(asString(node));
        return values;
    }

    /**
     * The attribute as received. {@code NullNode} for an explicit null, {@code MissingNode} when absent.
     */
    public static JsonNode asRawValue(Map<String, JsonNode> attrs, String key) {
        return value(attrs, key);
    }

    /**
     * Present and not JSON null.
     */
    public static boolean has(Map<String, JsonNode> attrs, String key) {
        var node = value(attrs, key);
        return !node.isMissingNode() && !node.isNull();
    }

    /**
     * Numbers, and strings that parse as numbers, in canonical text form; anything else {@code ""}.
     */
    public static String asNumberString(Map<String, JsonNode> attrs, String key) {
        var node = value(attrs, key);
        if (node.isNumber()) {
            return asString(node);
        }
        if (node.isTextual()) {
            var parsed = parseDecimal(node.textValue());
            return parsed == null ? "" : canonical(parsed);
        }
        return "";
    }

    public static double asDouble(Map<String, JsonNode> attrs, String key) {
        var node = value(attrs, key);
        if (node.isNumber()) {
            return Double.isFinite(node.doubleValue()) ? node.doubleValue() : 0d;
        }
        if (node.isTextual()) {
            var parsed = parseDecimal(node.textValue());
            return parsed == null ? 0d : parsed.doubleValue();
        }
        return 0d;
    }

    public static int asInt(Map<String, JsonNode> attrs, String key) {
        var node = value(attrs, key);
        if (node.isNumber()) {
            return Double.isFinite(node.doubleValue()) ? node.intValue() : 0;
        }
        if (node.isTextual()) {
            var parsed = parseDecimal(node.textValue());
            return parsed == null ? 0 : (int) parsed.doubleValue();
        }
        return 0;
    }

    private static JsonNode value(Map<String, JsonNode> attrs, String key) {
        if (attrs == null || key == null) {
            return MissingNode.getInstance();
        }
        var node = attrs.get(key);
        return node == null ? MissingNode.getInstance() : node;
    }

    /**
     * Same conversion as {@link #asString(Map, String)} for a value already in hand.
     */
    public static String asString(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (node.isTextual()) {
            return node.textValue();
        }
        if (node.isFloatingPointNumber()) {
            // 1e400 reads as an infinite double, which has no decimal form
            if ((node.isDouble() || node.isFloat()) && !Double.isFinite(node.doubleValue())) {
                return node.asText();
            }
            return canonical(node.decimalValue());
        }
        if (node.isValueNode()) {
            return node.asText();
        }
        return node.toString();
    }

    private static String canonical(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static BigDecimal parseDecimal(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            var trimmed = raw.trim();
            // BigDecimal accepts exponents far beyond what a double can hold
            return Double.isFinite(Double.parseDouble(trimmed)) ? new BigDecimal(trimmed) : null;
        } catch (NumberFormatException ignored) {
            return null;
        }
    }
}
