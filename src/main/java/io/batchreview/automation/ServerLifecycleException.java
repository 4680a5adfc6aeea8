package io.batchreview.automation;

public final class ServerLifecycleException extends RuntimeException {
    public ServerLifecycleException(String message) {
        super(message);
    }

    public ServerLifecycleException(String message, Throwable cause) {
        super(message, cause);
    }
}
