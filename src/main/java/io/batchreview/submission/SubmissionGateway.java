package io.batchreview.submission;

import io.batchreview.backend.ReviewBackend;
import io.batchreview.backend.VoteRequest;
import io.batchreview.model.BackendResult;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.SubmitStatus;
import io.batchreview.queue.BatchOrganizer;
import io.batchreview.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Bulk vote and submit over the Batch.
 *
 * <p>Every entry point consumes a {@link HumanConfirmation} for exactly the items it is given.
 * Items are processed one at a time in organized order (chain bases before their dependents),
 * and one item's failure never stops the rest.
 */
public final class SubmissionGateway {
    private static final Logger LOG = LoggerFactory.getLogger(SubmissionGateway.class);

    private final ReviewBackend backend;
    private final BatchOrganizer organizer;
    private final BatchQueueHandle queue;
    private final String approvingLabel;
    private final int approvingValue;

    public SubmissionGateway(
            ReviewBackend backend,
            BatchOrganizer organizer,
            BatchQueueHandle queue,
            String approvingLabel,
            int approvingValue
    ) {
        this.backend = backend;
        this.organizer = organizer;
        this.queue = queue;
        this.approvingLabel = approvingLabel;
        this.approvingValue = approvingValue;
    }

    /**
     * Posts {@code vote} on every item, then drops those items from the Batch whatever the
     * outcomes were. Changes staged while the vote ran stay staged.
     */
    public CompletableFuture<SubmissionReport> applyVote(
            HumanConfirmation confirmation,
            List<ReviewItem> items,
            VoteRequest vote
    ) {
        confirmation.consume(SubmissionAction.VOTE, ids(items));
        return ordered(items)
                .thenCompose(sorted -> sequentially(sorted, item -> vote(item, vote)))
                .thenCompose(outcomes -> queue.discard(ids(items))
                        .thenApply(ignored -> report(SubmissionAction.VOTE, outcomes)));
    }

    /**
     * Posts only the approving label. Items stay in the Batch; successful ones are flagged as
     * approved.
     */
    public CompletableFuture<SubmissionReport> applyApprovingVoteOnly(HumanConfirmation confirmation, List<ReviewItem> items) {
        confirmation.consume(SubmissionAction.APPROVE, ids(items));
        return approve(items).thenApply(outcomes -> report(SubmissionAction.APPROVE, outcomes));
    }

    /**
     * Submits every item whose remote status is submittable at the moment it is reached.
     * Submitted items leave the Batch; skipped and failed ones stay for a retry.
     */
    public CompletableFuture<SubmissionReport> submitAll(HumanConfirmation confirmation, List<ReviewItem> items) {
        confirmation.consume(SubmissionAction.SUBMIT, ids(items));
        return submit(items).thenApply(outcomes -> report(SubmissionAction.SUBMIT, outcomes));
    }

    /**
     * Approves every item, then submits those still in the Batch. An item whose approval failed
     * reports that failure.
     */
    public CompletableFuture<SubmissionReport> approveAndSubmitAll(HumanConfirmation confirmation, List<ReviewItem> items) {
        confirmation.consume(SubmissionAction.APPROVE_AND_SUBMIT, ids(items));
        return approve(items).thenCompose(approvals -> queue.batch().thenCompose(current -> {
            Set<String> stillStaged = new HashSet<>(ids(current));
            Map<String, ItemOutcome> byId = new LinkedHashMap<>();
            List<ReviewItem> toSubmit = new ArrayList<>();
            for (ItemOutcome approval : approvals) {
                byId.put(approval.restId(), approval);
            }
            for (ReviewItem item : current) {
                ItemOutcome approval = byId.get(item.restId());
                if (approval != null && approval.succeeded() && stillStaged.contains(item.restId())) {
                    toSubmit.add(item);
                }
            }
            return submit(toSubmit).thenApply(submissions -> {
                for (ItemOutcome submission : submissions) {
                    byId.put(submission.restId(), submission);
                }
                return report(SubmissionAction.APPROVE_AND_SUBMIT, new ArrayList<>(byId.values()));
            });
        }));
    }

    private CompletableFuture<List<ItemOutcome>> approve(List<ReviewItem> items) {
        VoteRequest vote = VoteRequest.labelsOnly(Map.of(approvingLabel, approvingValue));
        return ordered(items).thenCompose(sorted -> sequentially(sorted, item -> vote(item, vote)
                .thenCompose(outcome -> outcome.succeeded()
                        ? queue.markApproved(item.restId()).thenApply(ignored -> outcome)
                        : CompletableFuture.completedFuture(outcome))));
    }

    private CompletableFuture<List<ItemOutcome>> submit(List<ReviewItem> items) {
        return ordered(items)
                .thenCompose(sorted -> sequentially(sorted, this::submitOne))
                .thenCompose(outcomes -> {
                    List<String> submitted = new ArrayList<>();
                    for (ItemOutcome outcome : outcomes) {
                        if (outcome.succeeded()) {
                            submitted.add(outcome.restId());
                        }
                    }
                    return queue.discard(submitted).thenApply(ignored -> outcomes);
                });
    }

    private CompletableFuture<ItemOutcome> vote(ReviewItem item, VoteRequest vote) {
        return backend.currentRevision(item.restId())
                .thenCompose(revision -> backend.postVote(item.restId(), revision, vote))
                .thenApply(result -> toOutcome(item, result));
    }

    // Status is re-read per item: an earlier submission in this run may have unblocked it.
    private CompletableFuture<ItemOutcome> submitOne(ReviewItem item) {
        return backend.submitStatus(item.restId()).thenCompose(status -> {
            if (!status.submittable()) {
                String reason = skipReason(status);
                return queue.markSkipped(item.restId(), reason)
                        .thenApply(ignored -> ItemOutcome.skipped(item.restId(), item.label(), reason));
            }
            return backend.submit(item.restId()).thenApply(result -> toOutcome(item, result));
        });
    }

    private CompletableFuture<List<ReviewItem>> ordered(List<ReviewItem> items) {
        return organizer.organizeAsync(items);
    }

    private static CompletableFuture<List<ItemOutcome>> sequentially(
            List<ReviewItem> items,
            Function<ReviewItem, CompletableFuture<ItemOutcome>> step
    ) {
        CompletableFuture<List<ItemOutcome>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (ReviewItem item : items) {
            chain = chain.thenCompose(done -> attempt(item, step).thenApply(outcome -> {
                done.add(outcome);
                return done;
            }));
        }
        return chain;
    }

    private static CompletableFuture<ItemOutcome> attempt(
            ReviewItem item,
            Function<ReviewItem, CompletableFuture<ItemOutcome>> step
    ) {
        CompletableFuture<ItemOutcome> future;
        try {
            future = step.apply(item);
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        return future.exceptionally(error -> {
            String message = Failures.rootMessage(error);
            LOG.warn("{} failed: {}", item.label(), message);
            return ItemOutcome.failed(item.restId(), item.label(), message);
        });
    }

    private static ItemOutcome toOutcome(ReviewItem item, BackendResult result) {
        if (result.success()) {
            return ItemOutcome.succeeded(item.restId(), item.label());
        }
        LOG.warn("{} rejected: {}", item.label(), result.error());
        return ItemOutcome.failed(item.restId(), item.label(), result.error());
    }

    private static String skipReason(SubmitStatus status) {
        String reason = status.skipReason();
        return reason == null ? "not submittable" : reason;
    }

    private static SubmissionReport report(SubmissionAction action, List<ItemOutcome> outcomes) {
        SubmissionReport report = new SubmissionReport(action, outcomes);
        LOG.info("{} finished: {} succeeded, {} failed", action, report.successCount(), report.failureCount());
        return report;
    }

    private static List<String> ids(List<ReviewItem> items) {
        List<String> out = new ArrayList<>(items.size());
        for (ReviewItem item : items) {
            out.add(item.restId());
        }
        return out;
    }
}
