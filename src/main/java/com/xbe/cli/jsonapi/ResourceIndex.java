package com.xbe.cli.jsonapi;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup table over a document's {@code included} resources, keyed by {@code (type, id)}.
 *
 * <p>When the same key appears more than once the later occurrence wins. Primary resources are not
 * indexed: a primary resource is not guaranteed to appear in {@code included}.
 */
public final class ResourceIndex {
    private static final Logger LOG = LoggerFactory.getLogger(ResourceIndex.class);
    private static final ResourceIndex EMPTY = new ResourceIndex(Map.of());

    private final Map<ResourceRef, Resource> resources;

    private ResourceIndex(Map<ResourceRef, Resource> resources) {
        this.resources = resources;
    }

    public static ResourceIndex empty() {
        return EMPTY;
    }

    public static ResourceIndex build(List<Resource> included) {
        if (included == null || included.isEmpty()) {
            return EMPTY;
        }
        var byKey = new LinkedHashMap<ResourceRef, Resource>(included.size() * 2);
        for (var resource : included) {
            var previous = byKey.put(resource.ref(), resource);
            if (previous != null) {
                LOG.debug("Included resource {} appears more than once; keeping the later occurrence", resource.ref());
            }
        }
        return new ResourceIndex(Collections.unmodifiableMap(byKey));
    }

    public Optional<Resource> lookup(ResourceRef ref) {
        if (ref == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(resources.get(ref));
    }

    public Optional<Resource> lookup(String type, String id) {
        if (type == null || id == null) {
            return Optional.empty();
        }
        return lookup(new ResourceRef(type, id));
    }

    /**
     * Hits for {@code refs} in ref order; refs that were never side-loaded are skipped.
     */
    public List<Resource> lookupAll(List<ResourceRef> refs) {
        var hits = new ArrayList<Resource>();
        if (refs == null) {
            return hits;
        }
        for (var ref : refs) {
            lookup(ref).ifPresent(hits::add);
        }
        return hits;
    }

    public boolean contains(ResourceRef ref) {
        return ref != null && resources.containsKey(ref);
    }

    /**
     * Distinct indexed resources, in the order their key was first seen.
     */
    public Collection<Resource> resources() {
        return resources.values();
    }

    public int size() {
        return resources.size();
    }

    public boolean isEmpty() {
        return resources.isEmpty();
    }
}
