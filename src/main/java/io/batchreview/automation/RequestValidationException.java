package io.batchreview.automation;

/**
 * A request body the automation server refuses. {@link #code()} is the machine-readable reason
 * returned as {@code error} in the 400 body.
 */
public final class RequestValidationException extends Exception {
    private final String code;

    public RequestValidationException(String code, String detail) {
        super(detail);
        this.code = code;
    }

    public String code() {
        return code;
    }

    public String detail() {
        return getMessage();
    }
}
