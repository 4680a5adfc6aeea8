package io.batchreview.submission;

import io.batchreview.model.ReviewItem;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Queue effects of a bulk action, applied by whoever owns the queues.
 */
public interface BatchQueueHandle {

    CompletableFuture<List<ReviewItem>> batch();

    /**
     * Drops the named items from the Batch without returning them to Incoming. Items staged
     * since are left alone.
     */
    CompletableFuture<Void> discard(List<String> restIds);

    CompletableFuture<Void> markApproved(String restId);

    CompletableFuture<Void> markSkipped(String restId, String reason);
}
