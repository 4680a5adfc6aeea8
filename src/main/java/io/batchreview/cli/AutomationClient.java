package io.batchreview.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.batchreview.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin client of a running automation server on the loopback interface.
 */
final class AutomationClient {
    private final String baseUrl;
    private final Duration timeout;
    private final HttpClient http;

    AutomationClient(int port, Duration timeout) {
        this("http://127.0.0.1:" + port, timeout);
    }

    AutomationClient(String baseUrl, Duration timeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
    }

    Response health() throws IOException, InterruptedException {
        return send("GET", "/health", null);
    }

    Response batch() throws IOException, InterruptedException {
        return send("GET", "/batch", null);
    }

    Response incoming() throws IOException, InterruptedException {
        return send("GET", "/incoming", null);
    }

    /**
     * @param scores severity token or legacy integer per id; may be empty
     */
    Response addToBatch(List<String> ids, Map<String, Object> scores) throws IOException, InterruptedException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("changeIDs", ids);
        if (scores != null && !scores.isEmpty()) {
            body.put("scores", scores);
        }
        return send("POST", "/batch", Jsons.toCompactJson(body));
    }

    Response clearBatch() throws IOException, InterruptedException {
        return send("DELETE", "/batch", null);
    }

    private Response send(String method, String path, String body) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(timeout);
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }
        HttpResponse<String> response = http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        String raw = response.body();
        JsonNode json = raw == null || raw.isBlank() ? null : Jsons.mapper().readTree(raw);
        return new Response(response.statusCode(), json);
    }

    record Response(int status, JsonNode body) {
        boolean ok() {
            return status / 100 == 2;
        }
    }
}
