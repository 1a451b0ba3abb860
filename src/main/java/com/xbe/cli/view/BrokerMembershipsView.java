package com.xbe.cli.view;

import com.xbe.cli.jsonapi.Attributes;
import com.xbe.cli.jsonapi.Relationships;
import com.xbe.cli.jsonapi.Resource;
import com.xbe.cli.jsonapi.ResourceIndex;
import com.xbe.cli.render.Cells;
import com.xbe.cli.render.Column;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code broker-memberships}. The broker comes from {@code broker} or, failing that, from the
 * polymorphic {@code organization} relationship.
 */
public final class BrokerMembershipsView implements ResourceView {
    private static final int USER_MAX = 20;
    private static final int BROKER_MAX = 25;
    private static final Map<String, String> QUERY = orderedQuery();

    @Override
    public String resourceType() {
        return "broker-memberships";
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
        row.put("user_id", Relationships.relatedId(resource, "user"));
        var user = Relationships.resolveTarget(resource, "user", index);
        row.put("user_name", user.map(u -> Attributes.asString(u.attributes(), "name").trim()).orElse(""));
        user.ifPresent(u -> {
            Rows.putIfPresent(row, "user_email", Attributes.asString(u.attributes(), "email-address"));
            Rows.putIfPresent(row, "user_mobile", Attributes.asString(u.attributes(), "mobile-number"));
        });

        var brokerId = Relationships.relatedId(resource, "broker");
        var brokerName = Relationships.resolveTarget(resource, "broker", index)
            .map(broker -> Attributes.asString(broker.attributes(), "company-name").trim())
            .orElse("");
        var organization = resource.relationship("organization").ref();
        if (brokerId.isEmpty() && organization.isPresent()) {
            brokerId = organization.get().id();
            brokerName = index.lookup(organization.get())
                .map(org -> Cells.firstNonEmpty(
                    Attributes.asString(org.attributes(), "company-name"),
                    Attributes.asString(org.attributes(), "name")
                ))
                .orElse("");
        }
        organization.ifPresent(ref -> Rows.putIfPresent(row, "organization_type", ref.type()));
        row.put("broker_id", brokerId);
        row.put("broker_name", brokerName);
        row.put("kind", Attributes.asString(attrs, "kind"));
        row.put("is_admin", Attributes.asBool(attrs, "is-admin"));
        Rows.putIfPresent(row, "title", Attributes.asString(attrs, "title"));
        Rows.putIfPresent(row, "external_employee_id", Attributes.asString(attrs, "external-employee-id"));
        Rows.putIfPresent(row, "color_hex", Attributes.asString(attrs, "color-hex"));
        return row;
    }

    @Override
    public List<Column> listColumns(List<Map<String, Object>> rows) {
        return List.of(
            Column.of("ID", "id"),
            Column.truncated("USER", "user_name", USER_MAX),
            Column.truncated("BROKER", "broker_name", BROKER_MAX),
            Column.of("KIND", "kind")
        );
    }

    private static Map<String, String> orderedQuery() {
        var query = new LinkedHashMap<String, String>();
        query.put("include", "user,organization,broker");
        query.put("fields[users]", "name,email-address,mobile-number");
        query.put("fields[brokers]", "company-name");
        return query;
    }
}
