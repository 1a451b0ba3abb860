package com.xbe.cli.render;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * One table column: a header and how to derive the cell text from a view row.
 */
public record Column(String header, Function<Map<String, Object>, String> cell) {
    public Column {
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(cell, "cell");
    }

    /**
     * Column showing the row value stored under {@code key}.
     */
    public static Column of(String header, String key) {
        return new Column(header, row -> Cells.text(row.get(key)));
    }

    /**
     * Like {@link #of(String, String)}, truncated to {@code max} characters.
     */
    public static Column truncated(String header, String key, int max) {
        return new Column(header, row -> Cells.truncate(Cells.text(row.get(key)), max));
    }

    public String render(Map<String, Object> row) {
        var value = cell.apply(row);
        return value == null ? "" : value;
    }
}
