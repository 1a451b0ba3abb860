package com.xbe.cli.api;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Raw response handed to the document parser.
 */
public record ApiResponse(int status, byte[] body) {
    public ApiResponse {
        Objects.requireNonNull(body, "body");
    }

    public String bodyText() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}
