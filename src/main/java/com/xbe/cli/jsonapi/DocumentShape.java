package com.xbe.cli.jsonapi;

/**
 * Expected form of a response's primary {@code data} member.
 */
public enum DocumentShape {
    SINGLE,
    COLLECTION,
    ANY
}
