package io.batchreview.automation;

import io.batchreview.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A validated {@code POST /batch} body: distinct ids in request order plus the severity assigned
 * to each scored id.
 */
public record BatchAddRequest(List<String> ids, Map<String, Severity> severities) {
    public BatchAddRequest {
        ids = List.copyOf(ids);
        severities = severities == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(severities));
    }
}
