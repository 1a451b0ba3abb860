package com.xbe.cli.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.xbe.cli.jsonapi.Attributes;
import java.util.Collection;
import java.util.StringJoiner;

/**
 * Text helpers for table cells.
 */
public final class Cells {
    private Cells() {}

    public static String text(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof JsonNode node) {
            return Attributes.asString(node);
        }
        if (value instanceof Collection<?> values) {
            var joiner = new StringJoiner(", ");
            for (var element : values) {
                var text = text(element);
                if (!text.isEmpty()) {
                    joiner.add(text);
                }
            }
            return joiner.toString();
        }
        if (value instanceof Boolean flag) {
            return flag ? "yes" : "no";
        }
        return value.toString();
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (max <= 0 || value.length() <= max) {
            return value;
        }
        if (max <= 3) {
            return value.substring(0, max);
        }
        return value.substring(0, max - 3) + "...";
    }

    public static String firstNonEmpty(String... values) {
        for (var value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    /**
     * {@code type/id} label for a polymorphic reference, or just the id when the type is unknown.
     */
    public static String polymorphic(String type, String id) {
        if (id == null || id.isBlank()) {
            return "";
        }
        if (type == null || type.isBlank()) {
            return id;
        }
        return type + "/" + id;
    }

    /**
     * {@code created-at} → {@code Created At}.
     */
    public static String label(String key) {
        var words = key.split("[-_]");
        var joiner = new StringJoiner(" ");
        for (var word : words) {
            if (word.isEmpty()) {
                continue;
            }
            joiner.add(Character.toUpperCase(word.charAt(0)) + word.substring(1));
        }
        return joiner.toString();
    }
}
