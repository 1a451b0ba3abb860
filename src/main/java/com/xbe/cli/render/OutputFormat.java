package com.xbe.cli.render;

import java.util.Locale;

/**
 * Output encodings supported by the renderers.
 */
public enum OutputFormat {
    TABLE,
    JSON,
    YAML,
    CSV;

    public static OutputFormat from(String value) {
        if (value == null || value.isBlank()) {
            return TABLE;
        }
        try {
            return OutputFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported output format: " + value);
        }
    }
}
