package com.xbe.cli.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.Objects;

/**
 * One relationship member of a resource: its decoded state plus the undecoded {@code data} member,
 * kept so that irregular to-many lists can be re-walked with {@link Relationships#extractIds(JsonNode)}.
 */
public record Relationship(RelationshipState state, JsonNode data, JsonNode links, JsonNode meta) {
    public Relationship {
        Objects.requireNonNull(state, "state");
        data = data == null ? MissingNode.getInstance() : data;
        links = links == null ? MissingNode.getInstance() : links;
        meta = meta == null ? MissingNode.getInstance() : meta;
    }

    /**
     * Builds a relationship from its wire object ({@code {"data": ..., "links": ...}}).
     */
    public static Relationship fromWire(JsonNode node) {
        if (node == null || !node.isObject()) {
            return new Relationship(RelationshipState.absent(), node, null, null);
        }
        var data = node.path("data");
        return new Relationship(Relationships.decode(data), data, node.get("links"), node.get("meta"));
    }

    /**
     * The raw {@code data} member ({@code MissingNode} when the server sent none).
     */
    public JsonNode raw() {
        return data;
    }
}
