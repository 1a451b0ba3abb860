package com.xbe.cli.api;

/**
 * Values given on the command line. {@code null} means "not given".
 */
public record ConfigOverrides(
    String baseUrl,
    String token,
    boolean noAuth,
    String format,
    boolean json,
    boolean omitNull,
    String timeout
) {
    public static ConfigOverrides none() {
        return new ConfigOverrides(null, null, false, null, false, false, null);
    }
}
