package com.xbe.cli.jsonapi;

import java.util.Objects;

/**
 * Identifies one resource by its {@code (type, id)} pair. Used both as a relationship target and as
 * the {@link ResourceIndex} key.
 */
public record ResourceRef(String type, String id) {
    public ResourceRef {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
    }

    public static ResourceRef of(String type, String id) {
        return new ResourceRef(type, id);
    }

    /**
     * Flat {@code type|id} form, used as the key of projected {@code included} sections.
     */
    public String key() {
        return type + "|" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
