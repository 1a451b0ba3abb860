package com.xbe.cli.cli;

import com.xbe.cli.jsonapi.Document;
import com.xbe.cli.jsonapi.DocumentParser;
import com.xbe.cli.jsonapi.DocumentShape;
import com.xbe.cli.jsonapi.ParseException;
import com.xbe.cli.jsonapi.SparseProjector;
import com.xbe.cli.render.Renderer;
import com.xbe.cli.view.ResourceViews;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * One parse-and-render cycle: response bytes to either the sparse projection or a fixed view.
 */
final class ResponsePresenter {
    private final Renderer renderer;
    private final ResourceViews views;

    ResponsePresenter(Renderer renderer, ResourceViews views) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.views = Objects.requireNonNull(views, "views");
    }

    /**
     * @param resourceType view to use; {@code null} picks the type of the first primary resource
     * @param sparse       render the raw projection instead of a fixed view
     */
    Document present(byte[] body, DocumentShape shape, String resourceType, boolean sparse)
        throws ParseException, IOException {
        var document = DocumentParser.parse(body, shape);
        if (sparse) {
            renderer.renderTree(SparseProjector.project(document));
            return document;
        }
        var view = views.forType(resolveType(resourceType, document));
        if (document.collection()) {
            var index = document.index();
            var rows = new ArrayList<Map<String, Object>>(document.primary().size());
            for (var resource : document.primary()) {
                rows.add(view.row(resource, index));
            }
            renderer.renderRows(view.noun(), view.listColumns(rows), rows);
        } else {
            var row = view.row(document.primary().get(0), document.index());
            renderer.renderDetail(view.detailColumns(row), row);
        }
        return document;
    }

    private static String resolveType(String resourceType, Document document) {
        if (resourceType != null && !resourceType.isBlank()) {
            return resourceType.trim();
        }
        if (!document.primary().isEmpty() && !document.primary().get(0).type().isEmpty()) {
            return document.primary().get(0).type();
        }
        return "resources";
    }
}
