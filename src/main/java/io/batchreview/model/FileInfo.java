package io.batchreview.model;

/**
 * One file touched by a change. {@code status} is {@code A}, {@code M}, {@code D} or {@code R}.
 */
public record FileInfo(
        String path,
        String status,
        int linesInserted,
        int linesDeleted
) {
}
