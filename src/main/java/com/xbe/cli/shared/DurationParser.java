package com.xbe.cli.shared;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses request timeouts such as {@code 30s}, {@code 2m} or {@code 1500} (milliseconds).
 */
public final class DurationParser {
    private DurationParser() {}

    /**
     * Blank input means "no timeout".
     *
     * @throws IllegalArgumentException when the value is not a non-negative amount with an optional unit
     */
    public static Optional<Duration> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String trimmed = raw.trim().toLowerCase(Locale.ROOT);
        long multiplier = 1L;
        String amount = trimmed;
        if (trimmed.endsWith("ms")) {
            amount = trimmed.substring(0, trimmed.length() - 2);
        } else if (trimmed.endsWith("s")) {
            amount = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 1_000L;
        } else if (trimmed.endsWith("m")) {
            amount = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 60_000L;
        } else if (trimmed.endsWith("h")) {
            amount = trimmed.substring(0, trimmed.length() - 1);
            multiplier = 3_600_000L;
        }
        long value;
        try {
            value = Long.parseLong(amount.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid timeout: " + raw);
        }
        if (value < 0) {
            throw new IllegalArgumentException("Timeout must not be negative: " + raw);
        }
        return Optional.of(Duration.ofMillis(value * multiplier));
    }
}
