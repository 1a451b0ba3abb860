package com.xbe.cli.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Parsed form of one response body. Built once per response and never mutated.
 *
 * @param primary   primary resources in server order; exactly one element when {@code collection} is false
 * @param included  side-loaded resources as received, duplicates included
 * @param collection whether {@code data} was an array
 */
public record Document(
    List<Resource> primary,
    List<Resource> included,
    boolean collection,
    JsonNode meta,
    JsonNode links
) {
    public Document {
        primary = List.copyOf(Objects.requireNonNull(primary, "primary"));
        included = included == null ? List.of() : List.copyOf(included);
        meta = meta == null ? MissingNode.getInstance() : meta;
        links = links == null ? MissingNode.getInstance() : links;
        if (!collection && primary.size() != 1) {
            throw new IllegalArgumentException("A single-resource document holds exactly one resource");
        }
    }

    public static Document single(Resource resource, List<Resource> included) {
        return new Document(List.of(resource), included, false, null, null);
    }

    public static Document collection(List<Resource> resources, List<Resource> included) {
        return new Document(resources, included, true, null, null);
    }

    /**
     * The primary resource of a single-resource document, empty for collections.
     */
    public Optional<Resource> single() {
        return collection ? Optional.empty() : Optional.of(primary.get(0));
    }

    public ResourceIndex index() {
        return ResourceIndex.build(included);
    }
}
