package io.batchreview.submission;

import java.util.List;

/**
 * An action a human has been shown but not yet confirmed. {@code restIds} is the Batch the
 * human saw, in the order it was shown.
 */
public record ArmedConfirmation(String token, SubmissionAction action, List<String> restIds, long expiresAtMs) {
    public ArmedConfirmation {
        restIds = List.copyOf(restIds);
    }
}
