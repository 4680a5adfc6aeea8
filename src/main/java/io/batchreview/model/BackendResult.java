package io.batchreview.model;

/**
 * Outcome of a single remote mutation. {@code error} holds the backend's message on failure.
 */
public record BackendResult(boolean success, String error) {
    private static final BackendResult OK = new BackendResult(true, null);

    public static BackendResult ok() {
        return OK;
    }

    public static BackendResult failed(String error) {
        return new BackendResult(false, error == null || error.isBlank() ? "unknown error" : error.trim());
    }
}
