package com.xbe.cli.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Values read from {@code config.toml}; every entry is optional.
 */
public record ConfigFile(
    Optional<String> baseUrl,
    Optional<String> token,
    Optional<String> format,
    Optional<Boolean> omitNull,
    Optional<String> timeout
) {
    private static final ConfigFile EMPTY = new ConfigFile(
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty(),
        Optional.empty()
    );

    public ConfigFile {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(omitNull, "omitNull");
        Objects.requireNonNull(timeout, "timeout");
    }

    public static ConfigFile empty() {
        return EMPTY;
    }
}
