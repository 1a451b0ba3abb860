package com.xbe.cli.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads response bodies from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {
    private Fixtures() {}

    public static byte[] bytes(String name) {
        try {
            return Files.readAllBytes(path(name));
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static String bytesAsText(String name) {
        return new String(bytes(name), StandardCharsets.UTF_8);
    }

    public static Path path(String name) {
        var url = Fixtures.class.getResource("/fixtures/" + name);
        if (url == null) {
            throw new IllegalArgumentException("Missing fixture: " + name);
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Bad fixture location: " + url, ex);
        }
    }
}
