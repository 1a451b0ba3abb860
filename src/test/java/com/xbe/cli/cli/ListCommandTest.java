package com.xbe.cli.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import com.xbe.cli.support.Fixtures;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ListCommandTest {
    private static final ObjectMapper JSON = new ObjectMapper();

    @TempDir
    Path tempDir;

    private HttpServer server;
    private CliHarness cli;
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastQuery = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        cli = new CliHarness(tempDir);
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/", exchange -> {
            var uri = exchange.getRequestURI();
            lastPath.set(uri.getPath());
            lastQuery.set(uri.getRawQuery() == null ? "" : URLDecoder.decode(uri.getRawQuery(), StandardCharsets.UTF_8));
            byte[] body;
            int status = 200;
            if (uri.getPath().equals("/v1/follows")) {
                body = Fixtures.bytes("follows-list.json");
            } else if (uri.getPath().equals("/v1/brokers/1")) {
                body = Fixtures.bytes("broker-show.json");
            } else {
                status = 404;
                body = Fixtures.bytes("errors.json");
            }
            exchange.sendResponseHeaders(status, body.length);
            exchange.getResponseBody().write(body);
            exchange.close();
        });
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @Test
    void listUsesViewQueryAndPaging() throws Exception {
        int exit = cli.run("list", "follows", "--base-url", baseUrl(), "--no-auth", "--json",
            "--filter", "creator=Project|300", "--sort", "-created-at");

        assertEquals(0, exit, cli.err());
        assertEquals("/v1/follows", lastPath.get());
        var query = lastQuery.get();
        assertTrue(query.contains("include=follower"));
        assertTrue(query.contains("fields[users]=name,email-address"));
        assertTrue(query.contains("page[limit]=50"));
        assertFalse(query.contains("page[offset]"));
        assertTrue(query.contains("sort=-created-at"));
        assertTrue(query.contains("filter[creator]=Project|300"));
        var rows = JSON.readTree(cli.out());
        assertEquals("Ada Lovelace", rows.get(0).path("follower_name").asText());
        assertFalse(rows.get(1).has("follower_name"));
    }

    @Test
    void fieldsReplaceViewQueryAndSwitchToProjection() throws Exception {
        int exit = cli.run("list", "follows", "--base-url", baseUrl(), "--no-auth",
            "--fields", "follows=created-at");

        assertEquals(0, exit, cli.err());
        var query = lastQuery.get();
        assertTrue(query.contains("fields[follows]=created-at"));
        assertFalse(query.contains("include="));
        var tree = JSON.readTree(cli.out());
        assertEquals(2, tree.path("data").size());
        assertTrue(tree.path("included").has("users|7"));
    }

    @Test
    void showFetchesSingleResource() {
        int exit = cli.run("show", "brokers", "1", "--base-url", baseUrl(), "--no-auth");

        assertEquals(0, exit, cli.err());
        assertEquals("/v1/brokers/1", lastPath.get());
        assertTrue(cli.out().contains("Company Name: Acme"));
    }

    @Test
    void httpErrorPrintsServerBody() {
        int exit = cli.run("show", "brokers", "99", "--base-url", baseUrl(), "--no-auth");

        assertEquals(1, exit);
        assertTrue(cli.err().contains("Record not found"));
        assertTrue(cli.err().contains("HTTP 404"));
    }

    @Test
    void rejectsInvalidResourceType() {
        assertEquals(2, cli.run("list", "follows/../x", "--base-url", baseUrl(), "--no-auth"));
    }

    @Test
    void rejectsMalformedFields() {
        assertEquals(2, cli.run("list", "follows", "--base-url", baseUrl(), "--no-auth", "--fields", "created-at"));
    }

    @Test
    void emptyFieldsetIsSentToServer() {
        int exit = cli.run("list", "follows", "--base-url", baseUrl(), "--no-auth",
            "--fields", "users=");

        assertEquals(0, exit, cli.err());
        assertTrue(lastQuery.get().contains("fields[users]="));
        assertFalse(lastQuery.get().contains("include="));
    }
}
