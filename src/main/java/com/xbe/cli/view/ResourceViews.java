package com.xbe.cli.view;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed views keyed by resource type; unknown types get a {@link GenericResourceView}.
 */
public final class ResourceViews {
    private final Map<String, ResourceView> views = new LinkedHashMap<>();

    public static ResourceViews defaults() {
        return new ResourceViews()
            .register(new FollowsView())
            .register(new BrokerMembershipsView());
    }

    public ResourceViews register(ResourceView view) {
        views.put(view.resourceType(), view);
        return this;
    }

    public ResourceView forType(String resourceType) {
        var view = views.get(resourceType);
        return view != null ? view : new GenericResourceView(resourceType);
    }

    public Map<String, ResourceView> entries() {
        return Collections.unmodifiableMap(views);
    }
}
