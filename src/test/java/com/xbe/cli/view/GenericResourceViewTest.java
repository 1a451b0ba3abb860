package com.xbe.cli.view;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.JsonNode;
import com.xbe.cli.jsonapi.DocumentParser;
import com.xbe.cli.jsonapi.DocumentShape;
import com.xbe.cli.support.Fixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class GenericResourceViewTest {
    @Test
    void flattensAttributesAndRelationships() throws Exception {
        var document = DocumentParser.parse(Fixtures.bytes("broker-show.json"), DocumentShape.SINGLE);
        var view = new GenericResourceView("brokers");

        var row = view.row(document.primary().get(0), document.index());

        assertEquals("1", row.get("id"));
        assertEquals("Acme", ((JsonNode) row.get("company-name")).textValue());
        assertTrue(row.containsKey("seller-id"));
        assertNull(row.get("seller-id"));
        assertEquals(List.of(), row.get("trucks-ids"));
        assertFalse(row.containsKey("customers-id"));
    }

    @Test
    void labelsSideLoadedTargets() throws Exception {
        var document = DocumentParser.parse(Fixtures.bytes("broker-memberships-list.json"), DocumentShape.COLLECTION);
        var view = new GenericResourceView("broker-memberships");

        var row = view.row(document.primary().get(1), document.index());

        assertEquals("10", row.get("organization-id"));
        assertEquals("Gamma Logistics", row.get("organization"));
        assertEquals("8", row.get("user-id"));
        assertFalse(row.containsKey("user"));
    }

    @Test
    void unknownTypesGetGenericView() {
        var views = ResourceViews.defaults();

        assertTrue(views.forType("follows") instanceof FollowsView);
        assertTrue(views.forType("trucks") instanceof GenericResourceView);
        assertEquals("broker memberships", views.forType("broker-memberships").noun());
    }

    @Test
    void attributesWinOverRelationshipKeys() throws Exception {
        var body = "{\"data\":{\"type\":\"jobs\",\"id\":\"5\","
            + "\"attributes\":{\"broker\":\"legacy text\",\"broker-id\":\"B-77\"},"
            + "\"relationships\":{\"broker\":{\"data\":{\"type\":\"brokers\",\"id\":\"9\"}},"
            + "\"customer\":{\"data\":{\"type\":\"customers\",\"id\":\"3\"}}}},"
            + "\"included\":[{\"type\":\"brokers\",\"id\":\"9\",\"attributes\":{\"company-name\":\"Beta\"}},"
            + "{\"type\":\"customers\",\"id\":\"3\",\"attributes\":{\"name\":\"Acme\"}}]}";
        var document = DocumentParser.parse(body, DocumentShape.SINGLE);

        var row = new GenericResourceView("jobs").row(document.primary().get(0), document.index());

        assertEquals("legacy text", ((JsonNode) row.get("broker")).textValue());
        assertEquals("B-77", ((JsonNode) row.get("broker-id")).textValue());
        assertEquals("3", row.get("customer-id"));
        assertEquals("Acme", row.get("customer"));
    }
}
