package io.batchreview.model;

import java.util.Locale;

public enum QueueKind {
    INCOMING,
    BATCH;

    public static QueueKind fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Queue name is required");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "incoming", "in" -> INCOMING;
            case "batch" -> BATCH;
            default -> throw new IllegalArgumentException("Unknown queue: " + raw);
        };
    }
}
