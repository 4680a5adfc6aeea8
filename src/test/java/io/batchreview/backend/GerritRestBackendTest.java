package io.batchreview.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.batchreview.model.BackendResult;
import io.batchreview.model.ChangeStatus;
import io.batchreview.model.FileInfo;
import io.batchreview.model.LabelInfo;
import io.batchreview.model.RelatedChange;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.SubmitStatus;
import io.batchreview.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class GerritRestBackendTest {
    private HttpServer stub;
    private final Map<String, Reply> replies = new ConcurrentHashMap<>();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private GerritRestBackend backend;

    @BeforeEach
    void startStub() throws IOException {
        stub = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        stub.createContext("/", this::handle);
        stub.start();
        backend = new GerritRestBackend(
                "http://127.0.0.1:" + stub.getAddress().getPort(),
                "reviewer",
                "secret",
                Duration.ofSeconds(5),
                "Code-Review",
                2
        );
    }

    @AfterEach
    void stopStub() {
        stub.stop(0);
    }

    @Test
    void listAssignedChangesParsesDetailedChanges() throws Exception {
        replies.put("/a/changes/", new Reply(200, ")]}'\n[{"
                + "\"id\":\"demo~main~I1\",\"change_id\":\"I1\",\"_number\":42,\"subject\":\"Fix it\","
                + "\"project\":\"demo\",\"branch\":\"main\",\"updated\":\"2024-05-01 10:00:00.000000000\","
                + "\"submittable\":true,\"owner\":{\"_account_id\":7,\"name\":\"Dana\"},"
                + "\"labels\":{\"Code-Review\":{\"all\":[{\"value\":2}]}}}]"));

        List<ReviewItem> items = backend.listAssignedChanges("is:open reviewer:self", 25).get(5, TimeUnit.SECONDS);

        assertEquals(1, items.size());
        ReviewItem item = items.get(0);
        assertEquals("demo~main~I1", item.restId());
        assertEquals("I1", item.vcsId());
        assertEquals(42, item.number());
        assertEquals("Dana", item.owner().name());
        assertTrue(item.submittable());
        assertTrue(item.hasApprovingVote());
        assertTrue(item.webUrl().endsWith("/c/demo/+/42"));
        Recorded request = requests.get(0);
        assertEquals("GET", request.method());
        assertTrue(request.rawQuery().contains("q=is%3Aopen+reviewer%3Aself"));
        assertTrue(request.rawQuery().contains("n=25"));
        String expected = "Basic " + Base64.getEncoder().encodeToString("reviewer:secret".getBytes(StandardCharsets.UTF_8));
        assertEquals(expected, request.authorization());
    }

    @Test
    void relatedChainKeepsServerOrder() throws Exception {
        replies.put("/a/changes/I2/revisions/current/related", new Reply(200, ")]}'{\"changes\":["
                + "{\"change_id\":\"I2\",\"commit\":{\"commit\":\"c2\"},\"_change_number\":2,\"status\":\"NEW\"},"
                + "{\"change_id\":\"I1\",\"commit\":{\"commit\":\"c1\"},\"_change_number\":1,\"status\":\"MERGED\"}]}"));
        replies.put("/a/changes/I9/revisions/current/related", new Reply(200, ")]}'{\"changes\":[]}"));

        List<RelatedChange> related = backend.relatedChain("I2").get(5, TimeUnit.SECONDS);

        assertEquals(new RelatedChange("c2", "I2", ChangeStatus.NEW, 2), related.get(0));
        assertEquals(ChangeStatus.MERGED, related.get(1).status());
        assertTrue(backend.relatedChain("I9").get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void fileListSkipsMagicFiles() throws Exception {
        replies.put("/a/changes/demo~main~I1/revisions/current/files", new Reply(200, ")]}'{"
                + "\"/COMMIT_MSG\":{\"status\":\"A\",\"lines_inserted\":10},"
                + "\"src/App.java\":{\"lines_inserted\":4,\"lines_deleted\":2},"
                + "\"docs/old.md\":{\"status\":\"D\",\"lines_deleted\":9}}"));

        List<FileInfo> files = backend.fileList("demo~main~I1").get(5, TimeUnit.SECONDS);

        assertEquals(List.of(
                new FileInfo("src/App.java", "M", 4, 2),
                new FileInfo("docs/old.md", "D", 0, 9)
        ), files);
    }

    @Test
    void submitStatusListsUnmetRequirements() throws Exception {
        replies.put("/a/changes/I1", new Reply(200, ")]}'{\"submittable\":false,\"submit_requirements\":["
                + "{\"name\":\"Code-Review\",\"status\":\"SATISFIED\"},"
                + "{\"name\":\"Verified\",\"status\":\"UNSATISFIED\"}]}"));

        SubmitStatus status = backend.submitStatus("I1").get(5, TimeUnit.SECONDS);

        assertFalse(status.submittable());
        assertEquals(List.of("Verified"), status.unmetRequirements());
    }

    @Test
    void rejectedWritesBecomeFailedResults() throws Exception {
        replies.put("/a/changes/I1/submit", new Reply(409, "change is new; blocked by I0"));
        replies.put("/a/changes/I2/submit", new Reply(200, ")]}'{}"));

        BackendResult rejected = backend.submit("I1").get(5, TimeUnit.SECONDS);
        BackendResult accepted = backend.submit("I2").get(5, TimeUnit.SECONDS);

        assertFalse(rejected.success());
        assertEquals("change is new; blocked by I0", rejected.error());
        assertTrue(accepted.success());
        assertEquals("POST", requests.get(0).method());
    }

    @Test
    void postVoteSendsReviewInput() throws Exception {
        replies.put("/a/changes/I1/revisions/rev1/review", new Reply(200, ")]}'{}"));
        VoteRequest vote = new VoteRequest(Map.of("Code-Review", 1), "nit", List.of("ana"), List.of(), null);

        assertTrue(backend.postVote("I1", "rev1", vote).get(5, TimeUnit.SECONDS).success());

        JsonNode sent = Jsons.mapper().readTree(requests.get(0).body());
        assertEquals(1, sent.path("labels").path("Code-Review").asInt());
        assertEquals("nit", sent.path("message").asText());
        assertEquals("ana", sent.path("reviewers").get(0).path("reviewer").asText());
    }

    @Test
    void failedReadsCompleteExceptionally() {
        replies.put("/a/changes/I1/detail", new Reply(404, "Not found: I1"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> backend.changeDetail("I1").get(5, TimeUnit.SECONDS));

        BackendException cause = assertInstanceOf(BackendException.class, error.getCause());
        assertEquals(404, cause.statusCode());
    }

    @Test
    void labelsKeepOnlyPermittedValues() throws Exception {
        replies.put("/a/changes/I1/detail", new Reply(200, ")]}'{"
                + "\"labels\":{\"Code-Review\":{\"values\":{\"-2\":\"Veto\",\" 0\":\"No score\",\"+2\":\"Approved\"}},"
                + "\"Verified\":{\"values\":{\"+1\":\"Verified\"}}},"
                + "\"permitted_labels\":{\"Code-Review\":[\" 0\",\"+2\"]}}"));

        List<LabelInfo> labels = backend.labels("I1").get(5, TimeUnit.SECONDS);

        assertEquals(1, labels.size());
        assertEquals("Code-Review", labels.get(0).name());
        assertEquals(2, labels.get(0).values().size());
        assertEquals("+2", labels.get(0).values().get(1).score());
    }

    @Test
    void reviewInputCarriesResolutionAsPatchsetComment() {
        VoteRequest vote = new VoteRequest(Map.of("Code-Review", 2), "ship it", List.of(), List.of("ops"), true);

        ObjectNode input = GerritRestBackend.reviewInput(vote);

        assertTrue(input.path("message").isMissingNode());
        JsonNode comment = input.path("comments").path("/PATCHSET_LEVEL").get(0);
        assertEquals("ship it", comment.path("message").asText());
        assertFalse(comment.path("unresolved").asBoolean());
        assertEquals("CC", input.path("reviewers").get(0).path("state").asText());
        assertEquals("KEEP", input.path("drafts").asText());
    }

    @Test
    void xssiPrefixIsStripped() {
        assertEquals("{}", GerritRestBackend.stripXssiPrefix(")]}'{}"));
        assertEquals("\n[]", GerritRestBackend.stripXssiPrefix(")]}'\n[]"));
        assertEquals("[]", GerritRestBackend.stripXssiPrefix("[]"));
        assertEquals("", GerritRestBackend.stripXssiPrefix(null));
    }

    @Test
    void approvingVoteNeedsTheConfiguredValue() throws Exception {
        JsonNode oneOnly = Jsons.mapper().readTree("{\"Code-Review\":{\"all\":[{\"value\":1}]}}");
        JsonNode approved = Jsons.mapper().readTree("{\"Code-Review\":{\"approved\":{\"_account_id\":1}}}");

        assertFalse(backend.hasApprovingVote(oneOnly));
        assertTrue(backend.hasApprovingVote(approved));
        assertNull(backend.toReviewItem(Jsons.mapper().readTree("{\"id\":\"x\"}")).webUrl());
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        requests.add(new Recorded(
                exchange.getRequestMethod(),
                exchange.getRequestURI().getPath(),
                exchange.getRequestURI().getRawQuery() == null ? "" : exchange.getRequestURI().getRawQuery(),
                exchange.getRequestHeaders().getFirst("Authorization"),
                body
        ));
        Reply reply = replies.getOrDefault(exchange.getRequestURI().getPath(), new Reply(404, "Not found"));
        byte[] bytes = reply.body().getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(reply.status(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private record Reply(int status, String body) {
    }

    private record Recorded(String method, String path, String rawQuery, String authorization, String body) {
    }
}
