package io.batchreview.model;

import java.util.Locale;
import java.util.Optional;

public enum Severity {
    CRITICAL(5),
    HIGH(4),
    MEDIUM(3),
    LOW(2),
    APPROVED(1);

    public static final int LEGACY_SCORE_MIN = 1;
    public static final int LEGACY_SCORE_MAX = 10;

    private final int priority;

    Severity(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }

    /**
     * Priority used for ordering; an item without a severity ranks below {@link #APPROVED}.
     */
    public static int priorityOf(Severity severity) {
        return severity == null ? 0 : severity.priority;
    }

    public static Optional<Severity> fromToken(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (Severity value : values()) {
            if (value.name().equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }

    public static Severity fromString(String raw) {
        return fromToken(raw).orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + raw));
    }

    /**
     * Maps a legacy 1-10 confidence score onto the severity scale. Higher confidence ranked
     * higher in the old ordering, so it maps to a higher priority.
     */
    public static Severity fromLegacyScore(int score) {
        if (score < LEGACY_SCORE_MIN || score > LEGACY_SCORE_MAX) {
            throw new IllegalArgumentException("Legacy score out of range 1..10: " + score);
        }
        if (score >= 9) {
            return CRITICAL;
        }
        if (score >= 7) {
            return HIGH;
        }
        if (score >= 5) {
            return MEDIUM;
        }
        if (score >= 3) {
            return LOW;
        }
        return APPROVED;
    }
}
