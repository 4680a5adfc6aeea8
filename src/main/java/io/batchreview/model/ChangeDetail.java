package io.batchreview.model;

public record ChangeDetail(
        String restId,
        String vcsId,
        int number,
        ChangeStatus status
) {
}
