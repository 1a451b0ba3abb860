package com.xbe.cli.jsonapi;

/**
 * Raised when a response body is not a usable JSON:API document. The only engine failure that reaches
 * a command; callers usually print it together with the raw body.
 */
public final class ParseException extends Exception {
    public ParseException(String message) {
        super(message);
    }

    public ParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
