package io.batchreview.submission;

import java.util.Locale;

public enum SubmissionAction {
    VOTE,
    APPROVE,
    SUBMIT,
    APPROVE_AND_SUBMIT;

    public static SubmissionAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Submission action is required");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (value) {
            case "vote" -> VOTE;
            case "approve" -> APPROVE;
            case "submit" -> SUBMIT;
            case "approve_submit", "approve_and_submit" -> APPROVE_AND_SUBMIT;
            default -> throw new IllegalArgumentException("Unknown submission action: " + raw);
        };
    }
}
