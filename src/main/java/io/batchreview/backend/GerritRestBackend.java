package io.batchreview.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.batchreview.model.BackendResult;
import io.batchreview.model.ChangeDetail;
import io.batchreview.model.ChangeStatus;
import io.batchreview.model.FileInfo;
import io.batchreview.model.LabelInfo;
import io.batchreview.model.Owner;
import io.batchreview.model.RelatedChange;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.SubmitStatus;
import io.batchreview.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ReviewBackend} over the Gerrit REST API. Authenticated calls go to the {@code /a/}
 * endpoints with HTTP basic auth; without a user the anonymous endpoints are used.
 */
public final class GerritRestBackend implements ReviewBackend {
    private static final Logger LOG = LoggerFactory.getLogger(GerritRestBackend.class);
    static final String XSSI_PREFIX = ")]}'";
    private static final Set<String> MAGIC_FILES = Set.of("/COMMIT_MSG", "/MERGE_LIST", "/PATCHSET_LEVEL");
    private static final String PATCHSET_LEVEL = "/PATCHSET_LEVEL";

    private final URI baseUri;
    private final String authorization;
    private final Duration timeout;
    private final String approvingLabel;
    private final int approvingValue;
    private final HttpClient http;

    public GerritRestBackend(
            String baseUrl,
            String user,
            String password,
            Duration timeout,
            String approvingLabel,
            int approvingValue
    ) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Gerrit URL is required");
        }
        String normalized = baseUrl.trim().endsWith("/") ? baseUrl.trim() : baseUrl.trim() + "/";
        this.baseUri = URI.create(normalized);
        this.authorization = user == null || user.isBlank()
                ? null
                : "Basic " + Base64.getEncoder().encodeToString(
                        (user + ":" + (password == null ? "" : password)).getBytes(StandardCharsets.UTF_8));
        this.timeout = timeout;
        this.approvingLabel = approvingLabel;
        this.approvingValue = approvingValue;
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public CompletableFuture<List<ReviewItem>> listAssignedChanges(String query, int limit) {
        String path = "changes/?q=" + encode(query)
                + "&n=" + limit
                + "&o=DETAILED_ACCOUNTS&o=DETAILED_LABELS&o=SUBMITTABLE";
        return getJson(path).thenApply(root -> {
            List<ReviewItem> out = new ArrayList<>();
            for (JsonNode node : root) {
                out.add(toReviewItem(node));
            }
            return out;
        });
    }

    @Override
    public CompletableFuture<List<RelatedChange>> relatedChain(String vcsId) {
        return getJson("changes/" + encode(vcsId) + "/revisions/current/related").thenApply(root -> {
            JsonNode changes = root.path("changes");
            List<RelatedChange> out = new ArrayList<>();
            if (!changes.isArray() || changes.size() < 2) {
                return out;
            }
            for (JsonNode entry : changes) {
                out.add(new RelatedChange(
                        entry.path("commit").path("commit").asText(""),
                        entry.path("change_id").asText(""),
                        ChangeStatus.fromString(entry.path("status").asText(null)),
                        entry.path("_change_number").asInt(0)
                ));
            }
            return out;
        });
    }

    @Override
    public CompletableFuture<ChangeDetail> changeDetail(String id) {
        return getJson("changes/" + encode(id) + "/detail").thenApply(root -> new ChangeDetail(
                root.path("id").asText(id),
                root.path("change_id").asText(""),
                root.path("_number").asInt(0),
                ChangeStatus.fromString(root.path("status").asText(null))
        ));
    }

    @Override
    public CompletableFuture<String> currentRevision(String restId) {
        return getJson("changes/" + encode(restId) + "?o=CURRENT_REVISION").thenApply(root -> {
            String revision = root.path("current_revision").asText("");
            if (revision.isBlank()) {
                throw new BackendException("No current revision for " + restId);
            }
            return revision;
        });
    }

    @Override
    public CompletableFuture<BackendResult> postVote(String restId, String revisionId, VoteRequest vote) {
        String path = "changes/" + encode(restId) + "/revisions/" + encode(revisionId) + "/review";
        return post(path, reviewInput(vote)).thenApply(GerritRestBackend::toResult);
    }

    @Override
    public CompletableFuture<BackendResult> submit(String restId) {
        return post("changes/" + encode(restId) + "/submit", Jsons.mapper().createObjectNode())
                .thenApply(GerritRestBackend::toResult);
    }

    @Override
    public CompletableFuture<SubmitStatus> submitStatus(String restId) {
        return getJson("changes/" + encode(restId) + "?o=SUBMITTABLE&o=SUBMIT_REQUIREMENTS").thenApply(root -> {
            List<String> unmet = new ArrayList<>();
            for (JsonNode requirement : root.path("submit_requirements")) {
                if ("UNSATISFIED".equalsIgnoreCase(requirement.path("status").asText(""))) {
                    unmet.add(requirement.path("name").asText("unnamed requirement"));
                }
            }
            return new SubmitStatus(root.path("submittable").asBoolean(false), unmet);
        });
    }

    @Override
    public CompletableFuture<List<FileInfo>> fileList(String restId) {
        return getJson("changes/" + encode(restId) + "/revisions/current/files").thenApply(root -> {
            List<FileInfo> out = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                if (MAGIC_FILES.contains(entry.getKey())) {
                    continue;
                }
                JsonNode file = entry.getValue();
                String status = file.path("status").asText("");
                out.add(new FileInfo(
                        entry.getKey(),
                        status.isBlank() ? "M" : status,
                        file.path("lines_inserted").asInt(0),
                        file.path("lines_deleted").asInt(0)
                ));
            }
            return out;
        });
    }

    @Override
    public CompletableFuture<List<LabelInfo>> labels(String restId) {
        return getJson("changes/" + encode(restId) + "/detail").thenApply(root -> {
            JsonNode permitted = root.path("permitted_labels");
            List<LabelInfo> out = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> labels = root.path("labels").fields();
            while (labels.hasNext()) {
                Map.Entry<String, JsonNode> label = labels.next();
                JsonNode allowed = permitted.path(label.getKey());
                if (!allowed.isArray()) {
                    continue;
                }
                Set<String> allowedScores = new HashSet<>();
                allowed.forEach(score -> allowedScores.add(score.asText().trim()));
                List<LabelInfo.LabelValue> values = new ArrayList<>();
                Iterator<Map.Entry<String, JsonNode>> declared = label.getValue().path("values").fields();
                while (declared.hasNext()) {
                    Map.Entry<String, JsonNode> value = declared.next();
                    if (allowedScores.contains(value.getKey().trim())) {
                        values.add(new LabelInfo.LabelValue(value.getKey(), value.getValue().asText("")));
                    }
                }
                out.add(new LabelInfo(label.getKey(), values));
            }
            return out;
        });
    }

    ReviewItem toReviewItem(JsonNode node) {
        JsonNode owner = node.path("owner");
        long accountId = owner.path("_account_id").asLong(0L);
        String ownerName = owner.hasNonNull("name") ? owner.path("name").asText() : "Account " + accountId;
        int number = node.path("_number").asInt(0);
        String project = node.path("project").asText("");
        return new ReviewItem(
                node.path("id").asText(),
                node.path("change_id").asText(""),
                number,
                node.path("subject").asText(""),
                project,
                node.path("branch").asText(""),
                new Owner(ownerName, accountId),
                node.path("updated").asText(""),
                null,
                null,
                false,
                node.path("submittable").asBoolean(false),
                hasApprovingVote(node.path("labels")),
                number > 0 ? baseUri + "c/" + project + "/+/" + number : null,
                null
        );
    }

    boolean hasApprovingVote(JsonNode labels) {
        JsonNode label = labels.path(approvingLabel);
        if (label.isMissingNode()) {
            return false;
        }
        if (label.hasNonNull("approved")) {
            return true;
        }
        for (JsonNode vote : label.path("all")) {
            if (vote.path("value").asInt(0) == approvingValue) {
                return true;
            }
        }
        return false;
    }

    static ObjectNode reviewInput(VoteRequest vote) {
        ObjectNode input = Jsons.mapper().createObjectNode();
        ObjectNode labels = input.putObject("labels");
        vote.labels().forEach(labels::put);
        if (vote.message() != null) {
            if (vote.resolved() == null) {
                input.put("message", vote.message());
            } else {
                ObjectNode comment = Jsons.mapper().createObjectNode();
                comment.put("message", vote.message());
                comment.put("unresolved", !vote.resolved());
                input.putObject("comments").putArray(PATCHSET_LEVEL).add(comment);
            }
        }
        if (!vote.reviewers().isEmpty() || !vote.cc().isEmpty()) {
            ArrayNode reviewers = input.putArray("reviewers");
            for (String reviewer : vote.reviewers()) {
                reviewers.addObject().put("reviewer", reviewer);
            }
            for (String cc : vote.cc()) {
                reviewers.addObject().put("reviewer", cc).put("state", "CC");
            }
        }
        input.put("drafts", "KEEP");
        return input;
    }

    static String stripXssiPrefix(String body) {
        if (body == null) {
            return "";
        }
        String trimmed = body.stripLeading();
        if (trimmed.startsWith(XSSI_PREFIX)) {
            return trimmed.substring(XSSI_PREFIX.length());
        }
        return trimmed;
    }

    private static BackendResult toResult(HttpResponse<String> response) {
        if (response.statusCode() / 100 == 2) {
            return BackendResult.ok();
        }
        String body = stripXssiPrefix(response.body()).trim();
        return BackendResult.failed(body.isEmpty() ? "HTTP " + response.statusCode() : body);
    }

    private CompletableFuture<JsonNode> getJson(String path) {
        HttpRequest request = request(path)
                .header("Accept", "application/json")
                .GET()
                .build();
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8))
                .thenApply(response -> {
                    if (response.statusCode() / 100 != 2) {
                        String body = response.body() == null ? "" : response.body().trim();
                        throw new BackendException(
                                "GET " + path + " failed status=" + response.statusCode()
                                        + (body.isEmpty() ? "" : ": " + body),
                                response.statusCode()
                        );
                    }
                    try {
                        return Jsons.mapper().readTree(stripXssiPrefix(response.body()));
                    } catch (IOException e) {
                        throw new BackendException("Unparsable response from " + path, response.statusCode(), e);
                    }
                });
    }

    private CompletableFuture<HttpResponse<String>> post(String path, JsonNode body) {
        HttpRequest request = request(path)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8))
                .build();
        LOG.debug("POST {}", path);
        return http.sendAsync(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    private HttpRequest.Builder request(String path) {
        String prefix = authorization == null ? "" : "a/";
        HttpRequest.Builder builder = HttpRequest.newBuilder(baseUri.resolve(prefix + path))
                .timeout(timeout);
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }
        return builder;
    }

    private static String encode(String id) {
        return URLEncoder.encode(id == null ? "" : id, StandardCharsets.UTF_8);
    }
}
