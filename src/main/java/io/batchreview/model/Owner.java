package io.batchreview.model;

public record Owner(
        String name,
        long accountId
) {
}
