package com.xbe.cli.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One JSON:API resource object. Attribute and relationship maps keep the order they were received in.
 */
public record Resource(
    String type,
    String id,
    Map<String, JsonNode> attributes,
    Map<String, Relationship> relationships
) {
    public Resource {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(id, "id");
        attributes = attributes == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        relationships = relationships == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(relationships));
    }

    public ResourceRef ref() {
        return new ResourceRef(type, id);
    }

    /**
     * Resolves the named relationship; see {@link Relationships#resolve(Resource, String)}.
     */
    public RelationshipState relationship(String name) {
        return Relationships.resolve(this, name);
    }
}
