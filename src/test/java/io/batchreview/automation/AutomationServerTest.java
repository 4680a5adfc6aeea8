package io.batchreview.automation;

import com.fasterxml.jackson.databind.JsonNode;
import io.batchreview.model.QueueKind;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.ServerState;
import io.batchreview.queue.ChangeQueueStore;
import io.batchreview.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.batchreview.backend.FakeReviewBackend.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class AutomationServerTest {
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    private StoreAccess access;
    private AutomationServer server;
    private int port;

    @BeforeEach
    void startServer() {
        access = new StoreAccess();
        server = new AutomationServer(access, new BatchRequestValidator(64, 10), 0, 256);
        port = server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop();
    }

    @Test
    void healthAnswersOk() throws Exception {
        HttpResponse<String> response = send("GET", "/health", null);

        assertEquals(200, response.statusCode());
        assertEquals("ok", json(response).path("status").asText());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
    }

    @Test
    void postStagesChangesWithSeverity() throws Exception {
        HttpResponse<String> response = send("POST", "/batch",
                "{\"changeIDs\":[\"A\",\"C\"],\"scores\":{\"A\":\"HIGH\",\"C\":9}}");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.path("success").asBoolean());
        assertEquals("A", body.path("batch").get(0).path("restId").asText());
        assertEquals("HIGH", body.path("batch").get(0).path("severity").asText());
        assertEquals("CRITICAL", body.path("batch").get(1).path("severity").asText());
        assertEquals(List.of("B"), access.store.ids(QueueKind.INCOMING));

        JsonNode incoming = json(send("GET", "/incoming", null)).path("incoming");
        assertEquals(1, incoming.size());
        assertEquals("B", incoming.get(0).path("restId").asText());
    }

    @Test
    void invalidScoreIsRejectedWithoutMutation() throws Exception {
        HttpResponse<String> outOfRange = send("POST", "/batch", "{\"changeIDs\":[\"A\"],\"scores\":{\"A\":11}}");
        HttpResponse<String> unknown = send("POST", "/batch", "{\"changeIDs\":[\"A\"],\"scores\":{\"A\":\"URGENT\"}}");

        assertEquals(400, outOfRange.statusCode());
        assertEquals("invalid_score", json(outOfRange).path("error").asText());
        assertEquals(400, unknown.statusCode());
        assertTrue(access.store.batch().isEmpty());
        assertEquals(0, access.addCalls);
    }

    @Test
    void oversizedBodyIsRefused() throws Exception {
        String padding = "x".repeat(1024);
        HttpResponse<String> response = send("POST", "/batch", "{\"changeIDs\":[\"" + padding + "\"]}");

        assertEquals(413, response.statusCode());
        JsonNode body = json(response);
        assertEquals("payload_too_large", body.path("error").asText());
        assertEquals(256, body.path("limitBytes").asLong());
        assertTrue(access.store.batch().isEmpty());
    }

    @Test
    void deleteReturnsEverythingToIncoming() throws Exception {
        send("POST", "/batch", "{\"changeIDs\":[\"A\",\"B\"]}");

        HttpResponse<String> response = send("DELETE", "/batch", null);

        assertEquals(200, response.statusCode());
        assertTrue(json(response).path("success").asBoolean());
        assertEquals(0, json(response).path("batch").size());
        assertEquals(0, json(send("GET", "/batch", null)).path("batch").size());
        assertEquals(3, access.store.incoming().size());
    }

    @Test
    void unknownRouteListsEndpoints() throws Exception {
        HttpResponse<String> response = send("POST", "/submit", "{}");

        assertEquals(404, response.statusCode());
        JsonNode body = json(response);
        assertEquals("not_found", body.path("error").asText());
        assertEquals("POST", body.path("method").asText());
        assertEquals(AutomationServer.AVAILABLE_ENDPOINTS.size(), body.path("availableEndpoints").size());
    }

    @Test
    void failingAccessYieldsInternalError() throws Exception {
        access.fail = true;

        HttpResponse<String> response = send("GET", "/batch", null);

        assertEquals(500, response.statusCode());
        assertEquals("internal_error", json(response).path("error").asText());
    }

    @Test
    void startIsIdempotentWhileRunning() throws Exception {
        assertEquals(ServerState.RUNNING, server.state());
        assertEquals(port, server.start());

        server.stop();
        server.stop();
        assertEquals(ServerState.STOPPED, server.state());
        assertEquals(0, server.port());
    }

    @Test
    void concurrentStartsBindOnce() throws Exception {
        AutomationServer fresh = new AutomationServer(new StoreAccess(), new BatchRequestValidator(64, 10), 0, 256);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Integer>> attempts = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                attempts.add(pool.submit(() -> {
                    go.await();
                    try {
                        return fresh.start();
                    } catch (ServerLifecycleException e) {
                        return -1;
                    }
                }));
            }
            go.countDown();
            List<Integer> ports = new ArrayList<>();
            for (Future<Integer> attempt : attempts) {
                int bound = attempt.get(10, TimeUnit.SECONDS);
                if (bound > 0) {
                    ports.add(bound);
                }
            }
            assertFalse(ports.isEmpty());
            for (Integer bound : ports) {
                assertEquals(fresh.port(), bound.intValue());
            }
            assertEquals(ServerState.RUNNING, fresh.state());
            assertNotEquals(port, fresh.port());
        } finally {
            fresh.stop();
            pool.shutdownNow();
        }
    }

    @Test
    void bindFailureLeavesServerStopped() {
        AutomationServer clash = new AutomationServer(new StoreAccess(), new BatchRequestValidator(64, 10), port, 256);

        try {
            clash.start();
        } catch (ServerLifecycleException expected) {
            assertEquals(ServerState.STOPPED, clash.state());
            return;
        }
        clash.stop();
        throw new AssertionError("second bind on port " + port + " should fail");
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + path))
                .timeout(Duration.ofSeconds(10));
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return Jsons.mapper().readTree(response.body());
    }

    private static final class StoreAccess implements BatchAccess {
        private final ChangeQueueStore store = new ChangeQueueStore();
        private volatile boolean fail;
        private volatile int addCalls;

        private StoreAccess() {
            store.replaceIncoming(List.of(item("A", 1), item("B", 2), item("C", 3)));
        }

        @Override
        public synchronized CompletableFuture<List<ReviewItem>> batchSnapshot() {
            if (fail) {
                return CompletableFuture.failedFuture(new IllegalStateException("store offline"));
            }
            return CompletableFuture.completedFuture(store.batch());
        }

        @Override
        public synchronized CompletableFuture<List<ReviewItem>> incomingSnapshot() {
            return CompletableFuture.completedFuture(store.incoming());
        }

        @Override
        public synchronized CompletableFuture<List<ReviewItem>> addToBatch(BatchAddRequest request) {
            addCalls++;
            store.addToBatch(request.ids(), request.severities(), null);
            return CompletableFuture.completedFuture(store.batch());
        }

        @Override
        public synchronized CompletableFuture<List<ReviewItem>> clearBatch() {
            store.clearBatch();
            return CompletableFuture.completedFuture(store.batch());
        }
    }
}
