package io.batchreview.model;

/**
 * Member of a relation chain as reported by the backend. {@code number} is 0 when the backend
 * did not report it.
 */
public record RelatedChange(
        String commit,
        String vcsId,
        ChangeStatus status,
        int number
) {
}
