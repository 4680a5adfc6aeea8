package io.batchreview.model;

import java.util.List;

/**
 * A change under review. Instances are immutable; queue operations replace items with
 * updated copies built by the {@code with*} methods.
 *
 * <p>{@code restId} is the stable composite key ({@code project~branch~Change-Id}) used by every
 * queue and selection operation. {@code vcsId} is the dependency-chain identifier (the
 * Change-Id) used for chain resolution.
 */
public record ReviewItem(
        String restId,
        String vcsId,
        int number,
        String subject,
        String project,
        String branch,
        Owner owner,
        String updatedAt,
        Severity severity,
        List<FileInfo> files,
        boolean filesLoaded,
        boolean submittable,
        boolean hasApprovingVote,
        String webUrl,
        String skipReason
) {
    public ReviewItem {
        if (restId == null || restId.isBlank()) {
            throw new IllegalArgumentException("restId is required");
        }
        files = files == null ? null : List.copyOf(files);
    }

    public static ReviewItem of(
            String restId,
            String vcsId,
            int number,
            String subject,
            String project,
            String branch,
            Owner owner,
            String updatedAt
    ) {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                null, null, false, false, false, null, null);
    }

    public ReviewItem withSeverity(Severity value) {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                value, files, filesLoaded, submittable, hasApprovingVote, webUrl, skipReason);
    }

    public ReviewItem withFiles(List<FileInfo> value) {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                severity, value == null ? List.of() : value, true, submittable, hasApprovingVote, webUrl, skipReason);
    }

    public ReviewItem withSubmittable(boolean value) {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                severity, files, filesLoaded, value, hasApprovingVote, webUrl, skipReason);
    }

    public ReviewItem withApprovingVote(boolean value) {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                severity, files, filesLoaded, submittable, value, webUrl, skipReason);
    }

    public ReviewItem withWebUrl(String value) {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                severity, files, filesLoaded, submittable, hasApprovingVote, value, skipReason);
    }

    public ReviewItem withSkipReason(String value) {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                severity, files, filesLoaded, submittable, hasApprovingVote, webUrl, value);
    }

    /**
     * Drops the badges that only make sense while the item sits in the Batch queue.
     */
    public ReviewItem withoutBatchBadges() {
        return new ReviewItem(restId, vcsId, number, subject, project, branch, owner, updatedAt,
                null, files, filesLoaded, false, hasApprovingVote, webUrl, null);
    }

    public String label() {
        return number > 0 ? "Change " + number : restId;
    }
}
