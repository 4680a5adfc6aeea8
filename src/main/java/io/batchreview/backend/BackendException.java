package io.batchreview.backend;

public final class BackendException extends RuntimeException {
    private final int statusCode;

    public BackendException(String message) {
        this(message, -1, null);
    }

    public BackendException(String message, int statusCode) {
        this(message, statusCode, null);
    }

    public BackendException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public BackendException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or -1 when the call never produced one.
     */
    public int statusCode() {
        return statusCode;
    }
}
