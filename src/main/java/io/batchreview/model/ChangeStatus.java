package io.batchreview.model;

import java.util.Locale;

public enum ChangeStatus {
    NEW,
    MERGED,
    ABANDONED,
    UNKNOWN;

    public static ChangeStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }
}
