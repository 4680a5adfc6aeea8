package io.batchreview.backend;

import io.batchreview.model.BackendResult;
import io.batchreview.model.ChangeDetail;
import io.batchreview.model.FileInfo;
import io.batchreview.model.LabelInfo;
import io.batchreview.model.RelatedChange;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.SubmitStatus;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * The remote code-review server, as seen by the orchestration core. Every call is asynchronous
 * and may complete exceptionally (usually with {@link BackendException}); timeouts are the
 * implementation's concern.
 */
public interface ReviewBackend {

    /**
     * Changes matching {@code query}, in the order the server returns them.
     */
    CompletableFuture<List<ReviewItem>> listAssignedChanges(String query, int limit);

    /**
     * Related changes of {@code vcsId}, tip first and base last. An empty list means the change
     * has no relations.
     */
    CompletableFuture<List<RelatedChange>> relatedChain(String vcsId);

    /**
     * Identity and lifecycle status of a change addressed by any identifier the server accepts.
     */
    CompletableFuture<ChangeDetail> changeDetail(String id);

    CompletableFuture<String> currentRevision(String restId);

    CompletableFuture<BackendResult> postVote(String restId, String revisionId, VoteRequest vote);

    CompletableFuture<BackendResult> submit(String restId);

    CompletableFuture<SubmitStatus> submitStatus(String restId);

    CompletableFuture<List<FileInfo>> fileList(String restId);

    /**
     * Labels the caller is permitted to vote on for {@code restId}.
     */
    CompletableFuture<List<LabelInfo>> labels(String restId);
}
