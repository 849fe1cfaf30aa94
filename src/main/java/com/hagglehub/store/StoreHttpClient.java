package com.hagglehub.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hagglehub.shared.config.StoreConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Thin JSON-over-HTTP access to the entity store API. Status handling is left to callers.
 */
public class StoreHttpClient {

    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public StoreHttpClient(StoreConfig config) {
        this.baseUrl = config.baseUrl().replaceAll("/+$", "");
        this.apiKey = config.apiKey();
        this.timeout = Duration.ofSeconds(Math.max(1, config.timeoutSeconds()));
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public HttpResponse<String> get(String path, Map<String, String> query)
            throws IOException, InterruptedException {
        var req = base(path + queryString(query))
                .GET()
                .build();
        return httpClient.send(req, HttpResponse.BodyHandlers.ofString());
    }

    public HttpResponse<String> post(String path, Object body, String idempotencyKey)
            throws IOException, InterruptedException {
        var builder = base(path)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
        if (idempotencyKey != null && !idempotencyKey.isBlank()) {
            builder.header("Idempotency-Key", idempotencyKey);
        }
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpRequest.Builder base(String pathAndQuery) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + pathAndQuery))
                .header("Accept", "application/json")
                .timeout(timeout);
        if (!apiKey.isBlank()) {
            builder.header("api_key", apiKey);
        }
        return builder;
    }

    private static String queryString(Map<String, String> query) {
        if (query == null || query.isEmpty()) return "";
        var joiner = new StringJoiner("&", "?", "");
        query.forEach((k, v) -> joiner.add(
                URLEncoder.encode(k, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }
}
