package io.batchreview.backend;

import java.util.List;
import java.util.Map;

/**
 * Review input applied to every change of a bulk vote. {@code resolved} is null when the caller
 * did not choose.
 */
public record VoteRequest(
        Map<String, Integer> labels,
        String message,
        List<String> reviewers,
        List<String> cc,
        Boolean resolved
) {
    public VoteRequest {
        if (labels == null || labels.isEmpty()) {
            throw new IllegalArgumentException("At least one label vote is required");
        }
        labels = Map.copyOf(labels);
        message = message == null || message.isBlank() ? null : message;
        reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
        cc = cc == null ? List.of() : List.copyOf(cc);
    }

    public static VoteRequest labelsOnly(Map<String, Integer> labels) {
        return new VoteRequest(labels, null, List.of(), List.of(), null);
    }
}
