package com.xbe.cli.view;

import com.xbe.cli.jsonapi.Attributes;
import com.xbe.cli.jsonapi.Resource;
import com.xbe.cli.jsonapi.ResourceIndex;
import com.xbe.cli.render.Cells;
import com.xbe.cli.render.Column;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code follows}: the follower is joined against the side-loaded users; the creator is polymorphic
 * (a project, a job, ...) and only its {@code type/id} is shown.
 */
public final class FollowsView implements ResourceView {
    private static final Map<String, String> QUERY = orderedQuery();

    @Override
    public String resourceType() {
        return "follows";
    }

    @Override
    public Map<String, String> defaultQuery() {
        return QUERY;
    }

    @Override
    public Map<String, Object> row(Resource resource, ResourceIndex index) {
        var attrs = resource.attributes();
        var row = new LinkedHashMap<String, Object>();
        row.put("id", resource.id());

        var follower = resource.relationship("follower");
        follower.ref().ifPresent(ref -> {
            row.put("follower_id", ref.id());
            index.lookup(ref).ifPresent(user -> {
                Rows.putIfPresent(row, "follower_name", Attributes.asString(user.attributes(), "name"));
                Rows.putIfPresent(row, "follower_email", Attributes.asString(user.attributes(), "email-address"));
            });
        });

        resource.relationship("creator").ref().ifPresent(ref -> {
            Rows.putIfPresent(row, "creator_type", ref.type());
            row.put("creator_id", ref.id());
        });

        Rows.putIfPresent(row, "created_at", Attributes.asString(attrs, "created-at"));
        Rows.putIfPresent(row, "updated_at", Attributes.asString(attrs, "updated-at"));
        return row;
    }

    @Override
    public List<Column> listColumns(List<Map<String, Object>> rows) {
        return List.of(
            Column.of("ID", "id"),
            new Column("FOLLOWER", row -> Cells.firstNonEmpty(
                Cells.text(row.get("follower_name")),
                Cells.text(row.get("follower_email")),
                Cells.text(row.get("follower_id"))
            )),
            new Column("CREATOR", row -> Cells.polymorphic(
                Cells.text(row.get("creator_type")),
                Cells.text(row.get("creator_id"))
            )),
            Column.of("CREATED", "created_at")
        );
    }

    private static Map<String, String> orderedQuery() {
        var query = new LinkedHashMap<String, String>();
        query.put("fields[follows]", "follower,creator,created-at,updated-at");
        query.put("include", "follower");
        query.put("fields[users]", "name,email-address");
        return query;
    }
}
