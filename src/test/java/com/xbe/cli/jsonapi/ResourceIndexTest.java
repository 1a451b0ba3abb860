package com.xbe.cli.jsonapi;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.node.TextNode;
import com.xbe.cli.support.Fixtures;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResourceIndexTest {
    private static Resource user(String id, String name) {
        return new Resource("users", id, Map.of("name", TextNode.valueOf(name)), Map.of());
    }

    @Test
    void laterDuplicateWins() {
        var index = ResourceIndex.build(List.of(user("7", "first"), user("8", "other"), user("7", "second")));

        assertEquals(2, index.size());
        assertEquals("second", Attributes.asString(index.lookup("users", "7").orElseThrow().attributes(), "name"));
    }

    @Test
    void keysOnTypeAndId() {
        var broker = new Resource("brokers", "7", Map.of(), Map.of());
        var index = ResourceIndex.build(List.of(user("7", "Ada"), broker));

        assertEquals("users", index.lookup(ResourceRef.of("users", "7")).orElseThrow().type());
        assertEquals("brokers", index.lookup(ResourceRef.of("brokers", "7")).orElseThrow().type());
        assertFalse(index.contains(ResourceRef.of("trucks", "7")));
    }

    @Test
    void emptyIndexFindsNothing() {
        var index = ResourceIndex.empty();

        assertTrue(index.isEmpty());
        assertTrue(index.lookup("users", "1").isEmpty());
        assertTrue(index.lookupAll(List.of(ResourceRef.of("users", "1"))).isEmpty());
    }

    @Test
    void brokerMembershipResolvesSideLoadedBroker() throws Exception {
        var document = DocumentParser.parse(Fixtures.bytes("broker-memberships-list.json"), DocumentShape.COLLECTION);
        var index = document.index();

        var first = Relationships.resolveTarget(document.primary().get(0), "broker", index).orElseThrow();

        assertEquals("Beta", Attributes.asString(first.attributes(), "company-name"));
        assertTrue(index.lookup("brokers", "404").isEmpty());
        assertTrue(index.lookup("users", "9").isEmpty());
    }

    @Test
    void withoutIncludedTheBrokerIsABareId() throws Exception {
        var body = "{\"data\":{\"type\":\"broker-memberships\",\"id\":\"501\",\"relationships\":"
            + "{\"broker\":{\"data\":{\"type\":\"brokers\",\"id\":\"9\"}}}}}";
        var document = DocumentParser.parse(body, DocumentShape.SINGLE);
        var membership = document.primary().get(0);

        assertTrue(document.index().isEmpty());
        assertEquals("9", Relationships.relatedId(membership, "broker"));
        assertTrue(Relationships.resolveTarget(membership, "broker", document.index()).isEmpty());
    }
}
