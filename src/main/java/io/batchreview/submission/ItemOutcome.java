package io.batchreview.submission;

/**
 * What happened to one change during a bulk action.
 */
public record ItemOutcome(String restId, String label, Status status, String detail) {
    public enum Status {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    public static ItemOutcome succeeded(String restId, String label) {
        return new ItemOutcome(restId, label, Status.SUCCEEDED, null);
    }

    public static ItemOutcome failed(String restId, String label, String detail) {
        return new ItemOutcome(restId, label, Status.FAILED, detail);
    }

    public static ItemOutcome skipped(String restId, String label, String reason) {
        return new ItemOutcome(restId, label, Status.SKIPPED, reason);
    }

    public boolean succeeded() {
        return status == Status.SUCCEEDED;
    }

    /**
     * One-line description for error listings, e.g. {@code Change 12: skipped (not submittable)}.
     */
    public String describe() {
        return switch (status) {
            case SUCCEEDED -> label + ": ok";
            case FAILED -> label + ": " + (detail == null || detail.isBlank() ? "failed" : detail);
            case SKIPPED -> label + ": skipped (" + (detail == null || detail.isBlank() ? "not submittable" : detail) + ")";
        };
    }
}
