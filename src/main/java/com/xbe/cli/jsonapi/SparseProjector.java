package com.xbe.cli.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Projects a parsed document into a schema-less {@code id/type/attributes/relationships/included}
 * tree, echoing exactly what the server returned for the requested fieldsets.
 *
 * <p>Relationships render by state: absent keys are omitted, null ones render as JSON null, to-one
 * as a {@code {type, id}} object and to-many as an array of those. Attributes are never filtered
 * or defaulted.
 */
public final class SparseProjector {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private SparseProjector() {}

    /**
     * A single document projects to one resource object (with {@code included} when side-loaded data
     * exists); a collection projects to {@code {"data": [...]}} in server order, with the same
     * optional {@code included} section.
     */
    public static JsonNode project(Document document) {
        var index = document.index();
        if (!document.collection()) {
            var projected = projectResource(document.primary().get(0));
            if (!index.isEmpty()) {
                projected.set("included", projectIncluded(index));
            }
            return projected;
        }
        var root = NODES.objectNode();
        var data = root.putArray("data");
        for (var resource : document.primary()) {
            data.add(projectResource(resource));
        }
        if (!index.isEmpty()) {
            root.set("included", projectIncluded(index));
        }
        return root;
    }

    public static ObjectNode projectResource(Resource resource) {
        var node = NODES.objectNode();
        node.put("id", resource.id());
        node.put("type", resource.type());
        var attributes = node.putObject("attributes");
        resource.attributes().forEach(attributes::set);
        var relationships = node.putObject("relationships");
        resource.relationships().forEach((name, relationship) -> {
            var state = relationship.state();
            switch (state.kind()) {
                case NULL -> relationships.putNull(name);
                case TO_ONE -> relationships.set(name, refNode(state.refs().get(0)));
                case TO_MANY -> {
                    ArrayNode refs = relationships.putArray(name);
                    state.refs().forEach(ref -> refs.add(refNode(ref)));
                }
                default -> {
                    // absent: omitted
                }
            }
        });
        return node;
    }

    private static ObjectNode projectIncluded(ResourceIndex index) {
        var included = NODES.objectNode();
        for (var resource : index.resources()) {
            included.set(resource.ref().key(), projectResource(resource));
        }
        return included;
    }

    private static ObjectNode refNode(ResourceRef ref) {
        var node = NODES.objectNode();
        node.put("type", ref.type());
        node.put("id", ref.id());
        return node;
    }
}
