package io.batchreview.model;

import java.util.List;

/**
 * Fresh submittability of a change and the requirements that are not yet met.
 */
public record SubmitStatus(boolean submittable, List<String> unmetRequirements) {
    public SubmitStatus {
        unmetRequirements = unmetRequirements == null ? List.of() : List.copyOf(unmetRequirements);
    }

    public String skipReason() {
        if (submittable) {
            return null;
        }
        if (unmetRequirements.isEmpty()) {
            return "not submittable";
        }
        return "unmet requirements: " + String.join(", ", unmetRequirements);
    }
}
