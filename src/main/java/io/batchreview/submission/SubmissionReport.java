package io.batchreview.submission;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate result of one bulk action. Skipped items count as failures.
 */
public record SubmissionReport(SubmissionAction action, List<ItemOutcome> outcomes) {
    public SubmissionReport {
        outcomes = List.copyOf(outcomes);
    }

    public int successCount() {
        int count = 0;
        for (ItemOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                count++;
            }
        }
        return count;
    }

    public int failureCount() {
        return outcomes.size() - successCount();
    }

    public List<String> errors() {
        List<String> out = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                out.add(outcome.describe());
            }
        }
        return out;
    }

    public List<String> succeededIds() {
        List<String> out = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            if (outcome.succeeded()) {
                out.add(outcome.restId());
            }
        }
        return out;
    }

    public List<String> failedIds() {
        List<String> out = new ArrayList<>();
        for (ItemOutcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                out.add(outcome.restId());
            }
        }
        return out;
    }

    /**
     * Counts line, then at most {@code limit} error lines, then {@code ...and N more} when
     * errors were cut.
     */
    public String summary(int limit) {
        StringBuilder out = new StringBuilder();
        out.append(successCount()).append(" succeeded, ").append(failureCount()).append(" failed");
        List<String> errors = errors();
        int shown = Math.min(Math.max(limit, 0), errors.size());
        for (int i = 0; i < shown; i++) {
            out.append(System.lineSeparator()).append("  ").append(errors.get(i));
        }
        if (errors.size() > shown) {
            out.append(System.lineSeparator()).append("  ...and ").append(errors.size() - shown).append(" more");
        }
        return out.toString();
    }
}
