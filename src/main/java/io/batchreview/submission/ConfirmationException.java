package io.batchreview.submission;

public final class ConfirmationException extends RuntimeException {
    public ConfirmationException(String message) {
        super(message);
    }
}
