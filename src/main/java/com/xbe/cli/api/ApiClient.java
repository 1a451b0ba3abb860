package com.xbe.cli.api;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Minimal JSON:API transport: one GET per call, bearer auth when a token is configured.
 */
public final class ApiClient {
    private static final Logger LOG = LoggerFactory.getLogger(ApiClient.class);
    static final String MEDIA_TYPE = "application/vnd.api+json";

    private final HttpClient http;
    private final String baseUrl;
    private final String token;
    private final Optional<Duration> timeout;

    public ApiClient(String baseUrl, String token, Optional<Duration> timeout) {
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.token = token == null ? "" : token.trim();
        // zero means "no timeout"; HttpClient rejects non-positive durations
        this.timeout = Objects.requireNonNull(timeout, "timeout").filter(value -> !value.isZero());
        var builder = HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL);
        this.timeout.ifPresent(builder::connectTimeout);
        this.http = builder.build();
    }

    /**
     * Issues {@code GET baseUrl + path?query}. Entries with a {@code null} value are left out.
     *
     * @throws ApiException on transport failure or an HTTP status of 400 and above
     */
    public ApiResponse get(String path, Map<String, String> query) {
        var uri = buildUri(path, query);
        var request = HttpRequest.newBuilder(uri)
            .header("Accept", MEDIA_TYPE)
            .GET();
        if (!token.isEmpty()) {
            request.header("Authorization", "Bearer " + token);
        }
        timeout.ifPresent(request::timeout);
        LOG.debug("GET {}", uri);
        HttpResponse<byte[]> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ApiException("Interrupted while requesting " + uri, ex);
        } catch (IOException ex) {
            throw new ApiException("Request to " + uri + " failed: " + ex.getMessage(), ex);
        }
        var body = response.body() == null ? new byte[0] : response.body();
        var result = new ApiResponse(response.statusCode(), body);
        LOG.debug("GET {} -> HTTP {} ({} bytes)", uri, result.status(), body.length);
        if (result.status() >= 400) {
            throw new ApiException(result.status(), "HTTP " + result.status() + " from " + uri, result.bodyText());
        }
        return result;
    }

    URI buildUri(String path, Map<String, String> query) {
        var normalizedPath = path == null || path.isEmpty() ? "" : (path.startsWith("/") ? path : "/" + path);
        var target = new StringBuilder(baseUrl).append(normalizedPath);
        if (query != null && !query.isEmpty()) {
            var joiner = new StringJoiner("&");
            // an empty value is sent as-is: fields[TYPE]= asks for no fields of TYPE
            query.forEach((key, value) -> {
                if (value != null) {
                    joiner.add(encode(key) + "=" + encode(value));
                }
            });
            if (joiner.length() > 0) {
                target.append('?').append(joiner);
            }
        }
        return URI.create(target.toString());
    }

    public String baseUrl() {
        return baseUrl;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String stripTrailingSlash(String value) {
        var trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
