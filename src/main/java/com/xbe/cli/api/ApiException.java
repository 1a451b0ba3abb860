package com.xbe.cli.api;

/**
 * HTTP failure carrying the response status and raw body so commands can echo the server's message.
 */
public final class ApiException extends RuntimeException {
    private final int status;
    private final String body;

    public ApiException(int status, String message, String body) {
        super(message);
        this.status = status;
        this.body = body == null ? "" : body;
    }

    public ApiException(String message, Throwable cause) {
        super(message, cause);
        this.status = 0;
        this.body = "";
    }

    public int status() {
        return status;
    }

    public String body() {
        return body;
    }
}
