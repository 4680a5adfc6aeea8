package io.batchreview.automation;

import io.batchreview.model.Severity;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

final class BatchRequestValidatorTest {
    private final BatchRequestValidator validator = new BatchRequestValidator(20, 3);

    @Test
    void acceptsSeverityTokensAndLegacyScores() throws Exception {
        BatchAddRequest request = parse("{\"changeIDs\":[\"A\",\"B\",\"A\"],\"scores\":{\"A\":\"critical\",\"B\":6}}");

        assertEquals(List.of("A", "B"), request.ids());
        assertEquals(Map.of("A", Severity.CRITICAL, "B", Severity.MEDIUM), request.severities());
    }

    @Test
    void scoresAreOptional() throws Exception {
        assertEquals(Map.of(), parse("{\"changeIDs\":[\"A\"]}").severities());
        assertEquals(Map.of(), parse("{\"changeIDs\":[\"A\"],\"scores\":null}").severities());
    }

    @Test
    void rejectsMalformedBodies() {
        assertCode("invalid_body", "");
        assertCode("invalid_body", "{not json");
        assertCode("invalid_body", "[\"A\"]");
        assertCode("invalid_change_ids", "{}");
        assertCode("invalid_change_ids", "{\"changeIDs\":\"A\"}");
        assertCode("invalid_change_ids", "{\"changeIDs\":[]}");
    }

    @Test
    void rejectsBadIds() {
        assertCode("too_many_change_ids", "{\"changeIDs\":[\"A\",\"B\",\"C\",\"D\"]}");
        assertCode("invalid_change_id", "{\"changeIDs\":[\"A\",7]}");
        assertCode("invalid_change_id", "{\"changeIDs\":[\"  \"]}");
        assertCode("invalid_change_id", "{\"changeIDs\":[\"" + "x".repeat(21) + "\"]}");
    }

    @Test
    void rejectsUnknownOrOutOfRangeScores() {
        assertCode("invalid_scores", "{\"changeIDs\":[\"A\"],\"scores\":[1]}");
        assertCode("invalid_score", "{\"changeIDs\":[\"A\"],\"scores\":{\"A\":11}}");
        assertCode("invalid_score", "{\"changeIDs\":[\"A\"],\"scores\":{\"A\":0}}");
        assertCode("invalid_score", "{\"changeIDs\":[\"A\"],\"scores\":{\"A\":\"URGENT\"}}");
        assertCode("invalid_score", "{\"changeIDs\":[\"A\"],\"scores\":{\"A\":7.5}}");
    }

    @Test
    void legacyScoresMapOntoSeverityBands() {
        assertEquals(Severity.CRITICAL, Severity.fromLegacyScore(10));
        assertEquals(Severity.HIGH, Severity.fromLegacyScore(7));
        assertEquals(Severity.LOW, Severity.fromLegacyScore(4));
        assertEquals(Severity.APPROVED, Severity.fromLegacyScore(1));
    }

    private BatchAddRequest parse(String body) throws RequestValidationException {
        return validator.parse(body.getBytes(StandardCharsets.UTF_8));
    }

    private void assertCode(String expected, String body) {
        RequestValidationException error = assertThrows(RequestValidationException.class, () -> parse(body));
        assertEquals(expected, error.code(), body);
    }
}
