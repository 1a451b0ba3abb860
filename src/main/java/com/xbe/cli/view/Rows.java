package com.xbe.cli.view;

import java.util.Collection;
import java.util.Map;

final class Rows {
    private Rows() {}

    /**
     * Skips blank strings and empty collections, matching how optional row fields are serialized.
     */
    static void putIfPresent(Map<String, Object> row, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof String text && text.isBlank()) {
            return;
        }
        if (value instanceof Collection<?> values && values.isEmpty()) {
            return;
        }
        row.put(key, value instanceof String text ? text.trim() : value);
    }
}
