package io.batchreview.automation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.batchreview.model.Severity;
import io.batchreview.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validates {@code POST /batch} bodies of the form
 * {@code {"changeIDs": [...], "scores": {"id": "HIGH" | 7}}}.
 *
 * <p>Any invalid entry rejects the whole request. Scores accept a severity token in any case or
 * a legacy integer confidence in 1..10, which is mapped onto the severity scale.
 */
public final class BatchRequestValidator {
    private final int maxIdLength;
    private final int maxIds;

    public BatchRequestValidator(int maxIdLength, int maxIds) {
        if (maxIdLength <= 0 || maxIds <= 0) {
            throw new IllegalArgumentException("limits must be > 0");
        }
        this.maxIdLength = maxIdLength;
        this.maxIds = maxIds;
    }

    public BatchAddRequest parse(byte[] body) throws RequestValidationException {
        if (body == null || body.length == 0) {
            throw new RequestValidationException("invalid_body", "request body is empty");
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(new String(body, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new RequestValidationException("invalid_body", "request body is not valid JSON");
        }
        if (root == null || !root.isObject()) {
            throw new RequestValidationException("invalid_body", "request body must be a JSON object");
        }
        List<String> ids = parseIds(root.get("changeIDs"));
        Map<String, Severity> severities = parseScores(root.get("scores"));
        return new BatchAddRequest(ids, severities);
    }

    private List<String> parseIds(JsonNode node) throws RequestValidationException {
        if (node == null || !node.isArray()) {
            throw new RequestValidationException("invalid_change_ids", "changeIDs must be an array of strings");
        }
        if (node.isEmpty()) {
            throw new RequestValidationException("invalid_change_ids", "changeIDs must not be empty");
        }
        if (node.size() > maxIds) {
            throw new RequestValidationException(
                    "too_many_change_ids",
                    "changeIDs holds " + node.size() + " entries, limit is " + maxIds
            );
        }
        Set<String> ids = new LinkedHashSet<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode entry = node.get(i);
            if (entry == null || !entry.isTextual()) {
                throw new RequestValidationException("invalid_change_id", "changeIDs[" + i + "] is not a string");
            }
            String id = entry.asText();
            if (id.isBlank()) {
                throw new RequestValidationException("invalid_change_id", "changeIDs[" + i + "] is empty");
            }
            if (id.length() > maxIdLength) {
                throw new RequestValidationException(
                        "invalid_change_id",
                        "changeIDs[" + i + "] exceeds " + maxIdLength + " characters"
                );
            }
            ids.add(id);
        }
        return new ArrayList<>(ids);
    }

    private Map<String, Severity> parseScores(JsonNode node) throws RequestValidationException {
        Map<String, Severity> out = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return out;
        }
        if (!node.isObject()) {
            throw new RequestValidationException("invalid_scores", "scores must be an object");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            Optional<Severity> severity = toSeverity(field.getValue());
            if (severity.isEmpty()) {
                throw new RequestValidationException(
                        "invalid_score",
                        "score for " + field.getKey() + " must be a severity or an integer in "
                                + Severity.LEGACY_SCORE_MIN + ".." + Severity.LEGACY_SCORE_MAX
                );
            }
            out.put(field.getKey(), severity.get());
        }
        return out;
    }

    static Optional<Severity> toSeverity(JsonNode value) {
        if (value == null) {
            return Optional.empty();
        }
        if (value.isTextual()) {
            return Severity.fromToken(value.asText());
        }
        if (value.isIntegralNumber() && value.canConvertToInt()) {
            int score = value.asInt();
            if (score >= Severity.LEGACY_SCORE_MIN && score <= Severity.LEGACY_SCORE_MAX) {
                return Optional.of(Severity.fromLegacyScore(score));
            }
        }
        return Optional.empty();
    }
}
