package com.xbe.cli.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import com.xbe.cli.jsonapi.DocumentParser;
import com.xbe.cli.jsonapi.DocumentShape;
import com.xbe.cli.support.Fixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class BrokerMembershipsViewTest {
    private final BrokerMembershipsView view = new BrokerMembershipsView();

    private List<Map<String, Object>> rows() throws Exception {
        var document = DocumentParser.parse(Fixtures.bytes("broker-memberships-list.json"), DocumentShape.COLLECTION);
        var index = document.index();
        return document.primary().stream().map(resource -> view.row(resource, index)).toList();
    }

    @Test
    void resolvesUserAndBroker() throws Exception {
        var row = rows().get(0);

        assertEquals("501", row.get("id"));
        assertEquals("7", row.get("user_id"));
        assertEquals("Ada Lovelace", row.get("user_name"));
        assertEquals("ada@example.com", row.get("user_email"));
        assertEquals("9", row.get("broker_id"));
        assertEquals("Beta", row.get("broker_name"));
        assertEquals("brokers", row.get("organization_type"));
        assertEquals(true, row.get("is_admin"));
        assertEquals("Dispatcher", row.get("title"));
    }

    @Test
    void nullBrokerFallsBackToOrganization() throws Exception {
        var row = rows().get(1);

        assertEquals("8", row.get("user_id"));
        assertEquals("", row.get("user_name"));
        assertFalse(row.containsKey("user_email"));
        assertEquals("10", row.get("broker_id"));
        assertEquals("Gamma Logistics", row.get("broker_name"));
        assertEquals(false, row.get("is_admin"));
        assertFalse(row.containsKey("title"));
    }

    @Test
    void listColumnsTruncate() throws Exception {
        var columns = view.listColumns(rows());
        var row = Map.<String, Object>of("broker_name", "An Extremely Long Broker Company Name");

        assertEquals("An Extremely Long Brok...", columns.get(2).render(row));
    }
}
