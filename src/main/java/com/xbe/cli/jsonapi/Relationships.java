package com.xbe.cli.jsonapi;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Relationship resolution helpers.
 *
 * <p>{@link #resolve(Resource, String)} only yields refs. Joining a ref against the included
 * resources is a separate step through {@link ResourceIndex}, because most call sites only need
 * the id and must work when the target was never side-loaded.
 */
public final class Relationships {
    private static final Logger LOG = LoggerFactory.getLogger(Relationships.class);

    private Relationships() {}

    /**
     * Returns the tri-state presence of {@code name} on {@code resource}. The wire {@code type} of
     * every ref is kept as sent, so polymorphic relationships need no special handling.
     */
    public static RelationshipState resolve(Resource resource, String name) {
        if (resource == null || name == null) {
            return RelationshipState.absent();
        }
        var relationship = resource.relationships().get(name);
        if (relationship == null) {
            return RelationshipState.absent();
        }
        return relationship.state();
    }

    /**
     * Id of a to-one relationship, or {@code ""} for every other state.
     */
    public static String relatedId(Resource resource, String name) {
        return resolve(resource, name).ref().map(ResourceRef::id).orElse("");
    }

    /**
     * Ids of a to-many relationship, or an empty list for every other state.
     */
    public static List<String> relatedIds(Resource resource, String name) {
        var state = resolve(resource, name);
        return state.isToMany() ? state.ids() : List.of();
    }

    /**
     * Joins a to-one relationship against {@code index}. Empty when the relationship is not a
     * populated to-one or when its target was not side-loaded.
     */
    public static Optional<Resource> resolveTarget(Resource resource, String name, ResourceIndex index) {
        return resolve(resource, name).ref().flatMap(index::lookup);
    }

    /**
     * Joins every ref of a relationship against {@code index}, skipping refs that were not side-loaded.
     */
    public static List<Resource> resolveTargets(Resource resource, String name, ResourceIndex index) {
        return index.lookupAll(resolve(resource, name).refs());
    }

    /**
     * Pulls every id out of a raw relationship form: an identifier array, a single identifier
     * object, or a whole relationship object carrying a {@code data} member. Malformed entries are
     * skipped.
     */
    public static List<String> extractIds(JsonNode raw) {
        var ids = new ArrayList<String>();
        for (var ref : extractRefs(raw)) {
            ids.add(ref.id());
        }
        return ids;
    }

    /**
     * Same walk as {@link #extractIds(JsonNode)}, keeping the {@code (type, id)} pairs.
     */
    public static List<ResourceRef> extractRefs(JsonNode raw) {
        var refs = new ArrayList<ResourceRef>();
        collectRefs(raw, refs);
        return refs;
    }

    static RelationshipState decode(JsonNode data) {
        if (data == null || data.isMissingNode()) {
            return RelationshipState.absent();
        }
        if (data.isNull()) {
            return RelationshipState.nullValue();
        }
        if (data.isArray()) {
            var refs = new ArrayList<ResourceRef>(data.size());
            collectRefs(data, refs);
            return RelationshipState.toMany(refs);
        }
        var ref = identifier(data);
        if (ref.isPresent()) {
            return RelationshipState.toOne(ref.get());
        }
        LOG.debug("Treating unusable to-one relationship data as null: {}", data);
        return RelationshipState.nullValue();
    }

    private static void collectRefs(JsonNode raw, List<ResourceRef> sink) {
        if (raw == null || raw.isMissingNode() || raw.isNull()) {
            return;
        }
        if (raw.isArray()) {
            for (var entry : raw) {
                var ref = identifier(entry);
                if (ref.isPresent()) {
                    sink.add(ref.get());
                } else {
                    LOG.debug("Skipping malformed relationship entry: {}", entry);
                }
            }
            return;
        }
        if (raw.isObject()) {
            if (!raw.has("id") && raw.has("data")) {
                collectRefs(raw.get("data"), sink);
                return;
            }
            identifier(raw).ifPresent(sink::add);
        }
    }

    private static Optional<ResourceRef> identifier(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        var id = DocumentParser.scalarText(node.get("id"));
        if (id.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new ResourceRef(DocumentParser.scalarText(node.get("type")), id));
    }
}
