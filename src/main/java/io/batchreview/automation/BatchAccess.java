package io.batchreview.automation;

import io.batchreview.model.ReviewItem;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The only view of the orchestration core the automation server gets. It can stage and unstage
 * changes and read the queues; it has no way to vote or submit.
 */
public interface BatchAccess {

    CompletableFuture<List<ReviewItem>> batchSnapshot();

    CompletableFuture<List<ReviewItem>> incomingSnapshot();

    /**
     * Stages the requested changes and completes with the Batch as it is afterwards.
     */
    CompletableFuture<List<ReviewItem>> addToBatch(BatchAddRequest request);

    /**
     * Returns every staged change to Incoming and completes with the (empty) Batch.
     */
    CompletableFuture<List<ReviewItem>> clearBatch();
}
