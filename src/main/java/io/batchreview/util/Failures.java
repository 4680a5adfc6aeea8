package io.batchreview.util;

public final class Failures {
    private Failures() {
    }

    /**
     * Message of the innermost cause, or its class name when it has none.
     */
    public static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
