package com.xbe.cli.jsonapi;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * Decodes JSON:API response bodies (single-resource or collection form) into {@link Document}s.
 */
public final class DocumentParser {
    private static final ObjectMapper JSON = JsonMapper.builder()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
        .build();

    private DocumentParser() {}

    public static Document parse(String body, DocumentShape shape) throws ParseException {
        return parse(body == null ? new byte[0] : body.getBytes(StandardCharsets.UTF_8), shape);
    }

    public static Document parse(byte[] body, DocumentShape shape) throws ParseException {
        JsonNode root;
        try {
            root = JSON.readTree(body == null ? new byte[0] : body);
        } catch (IOException ex) {
            throw new ParseException("invalid JSON response: " + ex.getMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ParseException("response is not a JSON object");
        }
        return parseTree(root, shape);
    }

    /**
     * Decodes an already-parsed response tree.
     */
    public static Document parseTree(JsonNode root, DocumentShape shape) throws ParseException {
        if (root == null || !root.isObject()) {
            throw new ParseException("response is not a JSON object");
        }
        var data = root.get("data");
        if (data == null) {
            var errors = root.get("errors");
            if (errors != null && errors.isArray()) {
                throw new ParseException("API returned errors: " + summarizeErrors(errors));
            }
            throw new ParseException("response has no data member");
        }
        var included = decodeResources(root.get("included"), "included");
        var meta = root.get("meta");
        var links = root.get("links");
        if (data.isObject()) {
            if (shape == DocumentShape.COLLECTION) {
                throw new ParseException("expected a collection response but data is an object");
            }
            return new Document(List.of(decodeResource(data, "data")), included, false, meta, links);
        }
        if (data.isArray()) {
            if (shape == DocumentShape.SINGLE) {
                throw new ParseException("expected a single-resource response but data is an array");
            }
            return new Document(decodeResources(data, "data"), included, true, meta, links);
        }
        throw new ParseException("data must be an object or an array, got " + data.getNodeType().name().toLowerCase(Locale.ROOT));
    }

    private static List<Resource> decodeResources(JsonNode node, String member) throws ParseException {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new ParseException(member + " must be an array");
        }
        var resources = new ArrayList<Resource>(node.size());
        for (int i = 0; i < node.size(); i++) {
            resources.add(decodeResource(node.get(i), member + "[" + i + "]"));
        }
        return resources;
    }

    private static Resource decodeResource(JsonNode node, String location) throws ParseException {
        if (node == null || !node.isObject()) {
            throw new ParseException(location + " is not a resource object");
        }
        var attributes = new LinkedHashMap<String, JsonNode>();
        var attributesNode = node.get("attributes");
        if (attributesNode != null && attributesNode.isObject()) {
            attributesNode.fields().forEachRemaining(entry -> attributes.put(entry.getKey(), entry.getValue()));
        }
        var relationships = new LinkedHashMap<String, Relationship>();
        var relationshipsNode = node.get("relationships");
        if (relationshipsNode != null && relationshipsNode.isObject()) {
            relationshipsNode.fields().forEachRemaining(entry ->
                relationships.put(entry.getKey(), Relationship.fromWire(entry.getValue()))
            );
        }
        return new Resource(scalarText(node.get("type")), scalarText(node.get("id")), attributes, relationships);
    }

    static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) {
            return "";
        }
        return node.asText();
    }

    private static String summarizeErrors(JsonNode errors) {
        var parts = new ArrayList<String>();
        for (var error : errors) {
            var title = error.path("title").asText("");
            var detail = error.path("detail").asText("");
            if (!title.isEmpty() && !detail.isEmpty() && !title.equals(detail)) {
                parts.add(title + ": " + detail);
            } else if (!detail.isEmpty()) {
                parts.add(detail);
            } else if (!title.isEmpty()) {
                parts.add(title);
            } else {
                parts.add(error.toString());
            }
        }
        return parts.isEmpty() ? "(no details)" : String.join("; ", parts);
    }
}
