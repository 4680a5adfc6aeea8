package io.batchreview.runtime;

import io.batchreview.backend.VoteRequest;
import io.batchreview.model.QueueKind;
import io.batchreview.model.Severity;
import io.batchreview.selection.SelectionEvent;
import io.batchreview.submission.SubmissionAction;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Inbound messages from the presentation layer. Each command knows which core operation it
 * stands for; {@link BatchReviewCore#execute(CoreCommand)} runs it.
 */
public interface CoreCommand {

    CompletableFuture<?> applyTo(BatchReviewCore core);

    record Refresh() implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.refreshIncoming();
        }
    }

    record AddToBatch(List<String> ids, Map<String, Severity> severities, Integer insertAt) implements CoreCommand {
        public AddToBatch {
            ids = List.copyOf(ids);
            severities = severities == null ? Map.of() : Map.copyOf(severities);
        }

        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.addToBatch(ids, severities, insertAt);
        }
    }

    record RemoveFromBatch(List<String> ids, Integer insertAt) implements CoreCommand {
        public RemoveFromBatch {
            ids = List.copyOf(ids);
        }

        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.removeFromBatch(ids, insertAt);
        }
    }

    record ClearBatch() implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.clearBatch();
        }
    }

    record Reorder(List<String> ids, QueueKind queue, int dropIndex) implements CoreCommand {
        public Reorder {
            ids = List.copyOf(ids);
        }

        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.reorder(ids, queue, dropIndex);
        }
    }

    record Organize() implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.organize();
        }
    }

    record Select(SelectionEvent event) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.select(event);
        }
    }

    record SelectAll(QueueKind queue) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.selectAll(queue);
        }
    }

    record SelectNone(QueueKind queue) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.selectNone(queue);
        }
    }

    record LoadFiles(String restId) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.loadFiles(restId);
        }
    }

    record StartServer() implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            try {
                return CompletableFuture.completedFuture(core.startServer());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
    }

    record StopServer() implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            core.stopServer();
            return CompletableFuture.completedFuture(null);
        }
    }

    /**
     * First half of a confirmed action: shows the human what will be acted on.
     */
    record Arm(SubmissionAction action) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.arm(action);
        }
    }

    record Vote(String token, VoteRequest vote) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.vote(token, vote);
        }
    }

    record Approve(String token) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.approveAll(token);
        }
    }

    record Submit(String token) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.submitAll(token);
        }
    }

    record ApproveAndSubmit(String token) implements CoreCommand {
        @Override
        public CompletableFuture<?> applyTo(BatchReviewCore core) {
            return core.approveAndSubmitAll(token);
        }
    }
}
