package com.xbe.cli.view;

import com.xbe.cli.jsonapi.Attributes;
import com.xbe.cli.jsonapi.Resource;
import com.xbe.cli.jsonapi.ResourceIndex;
import com.xbe.cli.render.Cells;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Schema-less fallback for resource types without a dedicated view.
 *
 * <p>Rows carry the id, every attribute as received, {@code <name>-id} for to-one relationships
 * (with a {@code <name>} label when the target was side-loaded) and {@code <name>-ids} for to-many
 * ones. Relationships that were not sent produce no keys, and an attribute keeps its key when a
 * relationship-derived key would collide with it.
 */
public final class GenericResourceView implements ResourceView {
    private static final List<String> LABEL_ATTRIBUTES = List.of("name", "company-name", "title");

    private final String resourceType;

    public GenericResourceView(String resourceType) {
        this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
    }

    @Override
    public String resourceType() {
        return resourceType;
    }

    @Override
    public Map<String, String> defaultQuery() {
        return Map.of();
    }

    @Override
    public Map<String, Object> row(Resource resource, ResourceIndex index) {
        var row = new LinkedHashMap<String, Object>();
        row.put("id", resource.id());
        row.putAll(resource.attributes());
        resource.relationships().forEach((name, relationship) -> {
            var state = relationship.state();
            switch (state.kind()) {
                case NULL -> putDerived(row, name + "-id", null);
                case TO_ONE -> {
                    var ref = state.refs().get(0);
                    putDerived(row, name + "-id", ref.id());
                    index.lookup(ref).map(GenericResourceView::label).filter(label -> !label.isEmpty())
                        .ifPresent(label -> putDerived(row, name, label));
                }
                case TO_MANY -> putDerived(row, name + "-ids", state.ids());
                default -> {
                    // not sent
                }
            }
        });
        return row;
    }

    /**
     * Relationship-derived keys never replace an attribute of the same name.
     */
    private static void putDerived(Map<String, Object> row, String key, Object value) {
        if (!row.containsKey(key)) {
            row.put(key, value);
        }
    }

    static String label(Resource target) {
        for (var key : LABEL_ATTRIBUTES) {
            var value = Attributes.asString(target.attributes(), key);
            if (!value.isBlank()) {
                return value.trim();
            }
        }
        return Cells.polymorphic(target.type(), target.id());
    }
}
