package io.batchreview.runtime;

import io.batchreview.automation.AutomationServer;
import io.batchreview.automation.BatchAccess;
import io.batchreview.automation.BatchAddRequest;
import io.batchreview.automation.BatchRequestValidator;
import io.batchreview.backend.ReviewBackend;
import io.batchreview.backend.VoteRequest;
import io.batchreview.chain.ChainInfoCache;
import io.batchreview.chain.ChainResolver;
import io.batchreview.config.BatchReviewSettings;
import io.batchreview.model.ChainInfo;
import io.batchreview.model.FileInfo;
import io.batchreview.model.LabelInfo;
import io.batchreview.model.QueueKind;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.ServerState;
import io.batchreview.model.Severity;
import io.batchreview.observability.AuditLogger;
import io.batchreview.queue.AddOutcome;
import io.batchreview.queue.BatchOrganizer;
import io.batchreview.queue.ChangeQueueStore;
import io.batchreview.queue.QueueSnapshot;
import io.batchreview.selection.SelectionAction;
import io.batchreview.selection.SelectionEvent;
import io.batchreview.selection.SelectionStateMachine;
import io.batchreview.submission.ArmedConfirmation;
import io.batchreview.submission.BatchQueueHandle;
import io.batchreview.submission.ConfirmationException;
import io.batchreview.submission.ConfirmationGate;
import io.batchreview.submission.HumanConfirmation;
import io.batchreview.submission.SubmissionAction;
import io.batchreview.submission.SubmissionGateway;
import io.batchreview.submission.SubmissionReport;
import io.batchreview.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One orchestration core instance: queues, selection, chain knowledge, the automation server and
 * the submission gateway, wired together and driven from a single owner thread.
 *
 * <p>Every public operation returns a future and never blocks the caller. State is only touched
 * inside tasks running on the owner thread, so no two mutations interleave. Remote results are
 * merged back through the same thread.
 */
public final class BatchReviewCore implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(BatchReviewCore.class);
    private static final String HUMAN = "reviewer";
    private static final String AUTOMATION = "automation";

    private final BatchReviewSettings settings;
    private final ReviewBackend backend;
    private final AuditLogger audit;
    private final ExecutorService owner;
    private final ChangeQueueStore store;
    private final ChainResolver chainResolver;
    private final BatchOrganizer organizer;
    private final SelectionStateMachine selection;
    private final ConfirmationGate confirmations;
    private final SubmissionGateway gateway;
    private final AutomationServer server;
    private final List<CoreListener> listeners;

    // Owner-thread state.
    private final Map<String, ChainInfo> chains;
    private List<LabelInfo> labels;
    private long organizeGeneration;

    /**
     * @param audit audit trail, or null to keep none
     */
    public BatchReviewCore(BatchReviewSettings settings, ReviewBackend backend, AuditLogger audit) {
        this.settings = settings;
        this.backend = backend;
        this.audit = audit;
        this.owner = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "batch-review-owner");
            thread.setDaemon(true);
            return thread;
        });
        this.store = new ChangeQueueStore();
        this.chainResolver = new ChainResolver(backend, new ChainInfoCache(settings.chainCacheMaxEntries()));
        this.organizer = new BatchOrganizer(chainResolver);
        this.selection = new SelectionStateMachine();
        this.confirmations = new ConfirmationGate(settings.confirmationTimeoutMs());
        this.gateway = new SubmissionGateway(
                backend,
                organizer,
                new QueueHandle(),
                settings.approvingLabel(),
                settings.approvingValue()
        );
        this.server = new AutomationServer(
                new AutomationAccess(),
                new BatchRequestValidator(settings.maxChangeIdLength(), settings.maxChangeIdsPerRequest()),
                settings.automationPort(),
                settings.maxRequestBytes()
        );
        this.listeners = new CopyOnWriteArrayList<>();
        this.chains = new HashMap<>();
        this.labels = null;
        this.store.addListener(this::onQueuesChanged);
    }

    public void addListener(CoreListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CoreListener listener) {
        listeners.remove(listener);
    }

    public BatchReviewSettings settings() {
        return settings;
    }

    public CompletableFuture<?> execute(CoreCommand command) {
        return command.applyTo(this);
    }

    public CompletableFuture<CoreSnapshot> snapshot() {
        return onOwner(this::captureSnapshot);
    }

    /**
     * Replaces Incoming with the result of the configured query. On failure Incoming is left
     * as it was and the returned future fails.
     */
    public CompletableFuture<Integer> refreshIncoming() {
        return backend.listAssignedChanges(settings.incomingQuery(), settings.incomingLimit())
                .whenComplete((items, error) -> {
                    if (error != null) {
                        LOG.warn("Refresh of incoming changes failed: {}", Failures.rootMessage(error));
                    }
                })
                .thenApplyAsync(store::replaceIncoming, owner);
    }

    public CompletableFuture<AddOutcome> addToBatch(Collection<String> ids, Map<String, Severity> severities, Integer insertAt) {
        return onOwner(() -> addNow(ids, severities, insertAt));
    }

    public CompletableFuture<List<String>> removeFromBatch(Collection<String> ids, Integer insertAt) {
        return onOwner(() -> {
            List<String> removed = store.removeFromBatch(ids, insertAt);
            if (!removed.isEmpty()) {
                forgetChains(removed);
                scheduleOrganize();
            }
            return removed;
        });
    }

    public CompletableFuture<List<String>> clearBatch() {
        return onOwner(this::clearNow);
    }

    /**
     * Moves items within one queue. A manual Batch order stands until the next membership change
     * or an explicit {@link #organize()}, and supersedes an organize run still in flight.
     */
    public CompletableFuture<Boolean> reorder(Collection<String> ids, QueueKind queue, int dropIndex) {
        return onOwner(() -> {
            boolean moved = store.reorder(ids, queue, dropIndex);
            if (moved && queue == QueueKind.BATCH) {
                organizeGeneration++;
            }
            return moved;
        });
    }

    /**
     * Re-sorts the Batch now. Completes with whether the order changed.
     */
    public CompletableFuture<Boolean> organize() {
        return onOwner(this::scheduleOrganize).thenCompose(Function.identity());
    }

    public CompletableFuture<Boolean> select(SelectionEvent event) {
        if (event.action() != SelectionAction.CHAIN) {
            return onOwner(() -> applySelection(event));
        }
        return onOwner(() -> store.items(event.list()))
                .thenCompose(organizer::resolveChains)
                .thenApplyAsync(resolved -> {
                    if (event.list() == QueueKind.BATCH) {
                        chains.putAll(resolved);
                    }
                    boolean changed = selection.apply(event, store.items(event.list()), resolved);
                    if (changed) {
                        publish();
                    }
                    return changed;
                }, owner);
    }

    public CompletableFuture<Void> selectAll(QueueKind queue) {
        return onOwner(() -> {
            selection.selectAll(queue, store.items(queue));
            publish();
            return null;
        });
    }

    public CompletableFuture<Void> selectNone(QueueKind queue) {
        return onOwner(() -> {
            selection.selectNone(queue);
            publish();
            return null;
        });
    }

    /**
     * Selected ids of {@code queue}, in list order.
     */
    public CompletableFuture<List<String>> selectedIds(QueueKind queue) {
        return onOwner(() -> selection.selectedInOrder(queue, store.items(queue)));
    }

    /**
     * Fetches and stores the file list of one change. A failed fetch stores an empty list.
     */
    public CompletableFuture<List<FileInfo>> loadFiles(String restId) {
        return onOwner(() -> store.find(restId).isPresent())
                .thenCompose(known -> {
                    if (!known) {
                        return CompletableFuture.completedFuture(List.<FileInfo>of());
                    }
                    return backend.fileList(restId)
                            .exceptionally(error -> {
                                LOG.warn("File list fetch failed for {}: {}", restId, Failures.rootMessage(error));
                                return List.of();
                            })
                            .thenApplyAsync(files -> {
                                store.updateItem(restId, item -> item.withFiles(files));
                                return files;
                            }, owner);
                });
    }

    public int startServer() {
        try {
            int port = server.start();
            audit("automation.server.start", HUMAN, "automation-server", "ok", Map.of("port", port));
            return port;
        } catch (RuntimeException e) {
            audit("automation.server.start", HUMAN, "automation-server", "failed",
                    Map.of("error", Failures.rootMessage(e)));
            throw e;
        } finally {
            owner.execute(this::publish);
        }
    }

    public void stopServer() {
        boolean wasRunning = server.state() == ServerState.RUNNING;
        server.stop();
        if (wasRunning) {
            audit("automation.server.stop", HUMAN, "automation-server", "ok", Map.of());
        }
        owner.execute(this::publish);
    }

    public ServerState serverState() {
        return server.state();
    }

    public int serverPort() {
        return server.port();
    }

    /**
     * Records the Batch the human is being shown for {@code action} and returns the token that
     * confirms it.
     */
    public CompletableFuture<ArmedConfirmation> arm(SubmissionAction action) {
        return onOwner(() -> {
            ArmedConfirmation armed = confirmations.arm(action, store.ids(QueueKind.BATCH));
            audit("confirmation.arm", HUMAN, "batch", "ok",
                    Map.of("action", action.name(), "changes", armed.restIds()));
            return armed;
        });
    }

    public void disarm(String token) {
        if (confirmations.disarm(token)) {
            audit("confirmation.disarm", HUMAN, "batch", "ok", Map.of());
        }
    }

    public CompletableFuture<SubmissionReport> vote(String token, VoteRequest vote) {
        return confirmed(token, SubmissionAction.VOTE,
                (confirmation, items) -> gateway.applyVote(confirmation, items, vote));
    }

    /**
     * Approves the whole Batch, then refreshes every remaining item's submittable flag.
     */
    public CompletableFuture<SubmissionReport> approveAll(String token) {
        return confirmed(token, SubmissionAction.APPROVE, gateway::applyApprovingVoteOnly)
                .thenCompose(report -> refreshSubmittable().thenApply(ignored -> report));
    }

    public CompletableFuture<SubmissionReport> submitAll(String token) {
        return confirmed(token, SubmissionAction.SUBMIT, gateway::submitAll);
    }

    public CompletableFuture<SubmissionReport> approveAndSubmitAll(String token) {
        return confirmed(token, SubmissionAction.APPROVE_AND_SUBMIT, gateway::approveAndSubmitAll);
    }

    /**
     * Re-reads the submittable status of every Batch item.
     */
    public CompletableFuture<Void> refreshSubmittable() {
        return onOwner(store::batch).thenCompose(batch -> {
            List<CompletableFuture<Void>> updates = new ArrayList<>(batch.size());
            for (ReviewItem item : batch) {
                updates.add(backend.submitStatus(item.restId())
                        .thenAcceptAsync(status -> store.updateItem(item.restId(), current -> current
                                .withSubmittable(status.submittable())
                                .withSkipReason(status.skipReason())), owner)
                        .exceptionally(error -> {
                            LOG.warn("Submittable check failed for {}: {}", item.label(), Failures.rootMessage(error));
                            return null;
                        }));
            }
            return CompletableFuture.allOf(updates.toArray(new CompletableFuture<?>[0]));
        });
    }

    @Override
    public void close() {
        server.stop();
        owner.shutdown();
        try {
            if (!owner.awaitTermination(5, TimeUnit.SECONDS)) {
                owner.shutdownNow();
            }
        } catch (InterruptedException e) {
            owner.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private AddOutcome addNow(Collection<String> ids, Map<String, Severity> severities, Integer insertAt) {
        AddOutcome outcome = store.addToBatch(ids, severities, insertAt);
        if (outcome.changed()) {
            scheduleOrganize();
            if (outcome.batchWasEmpty() && labels == null) {
                fetchLabels(outcome.added().get(0));
            }
        }
        return outcome;
    }

    private List<String> clearNow() {
        List<String> cleared = store.clearBatch();
        forgetChains(cleared);
        organizeGeneration++;
        return cleared;
    }

    private CompletableFuture<SubmissionReport> confirmed(
            String token,
            SubmissionAction action,
            GatewayCall call
    ) {
        return onOwner(() -> {
            List<ReviewItem> batch = store.batch();
            try {
                HumanConfirmation confirmation = confirmations.confirm(token, action, store.ids(QueueKind.BATCH));
                audit("confirmation.confirm", HUMAN, "batch", "ok", Map.of("action", action.name()));
                return call.run(confirmation, batch);
            } catch (ConfirmationException e) {
                audit("confirmation.confirm", HUMAN, "batch", "rejected",
                        Map.of("action", action.name(), "error", e.getMessage()));
                throw e;
            }
        }).thenCompose(Function.identity()).whenComplete((report, error) -> {
            if (report != null) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("succeeded", report.successCount());
                details.put("failed", report.failureCount());
                details.put("failedChanges", report.failedIds());
                audit("batch." + action.name().toLowerCase(Locale.ROOT), HUMAN, "batch",
                        report.failureCount() == 0 ? "ok" : "partial", details);
            }
        });
    }

    /**
     * Resolves chains for the current Batch and applies the organized order if it differs.
     * A newer membership change supersedes a pending run.
     */
    private CompletableFuture<Boolean> scheduleOrganize() {
        long generation = ++organizeGeneration;
        List<ReviewItem> batch = store.batch();
        return organizer.resolveChains(batch).thenApplyAsync(resolved -> {
            boolean learned = false;
            for (Map.Entry<String, ChainInfo> entry : resolved.entrySet()) {
                if (!entry.getValue().equals(chains.put(entry.getKey(), entry.getValue()))) {
                    learned = true;
                }
            }
            if (generation != organizeGeneration) {
                return false;
            }
            List<ReviewItem> ordered = BatchOrganizer.organize(store.batch(), chains);
            boolean changed = store.applyBatchOrder(ordered);
            if (!changed && learned) {
                // Order stands but chain badges are new.
                publish();
            }
            return changed;
        }, owner);
    }

    private void fetchLabels(String restId) {
        backend.labels(restId)
                .exceptionally(error -> {
                    LOG.warn("Label lookup failed for {}, using defaults: {}", restId, Failures.rootMessage(error));
                    return List.of();
                })
                .thenAcceptAsync(fetched -> {
                    if (labels == null) {
                        labels = fetched == null || fetched.isEmpty() ? List.of(LabelInfo.defaultCodeReview()) : fetched;
                        publish();
                    }
                }, owner);
    }

    private boolean applySelection(SelectionEvent event) {
        boolean changed = selection.apply(event, store.items(event.list()), chains);
        if (changed) {
            publish();
        }
        return changed;
    }

    private void forgetChains(Collection<String> restIds) {
        for (String restId : restIds) {
            chains.remove(restId);
        }
    }

    private void onQueuesChanged(QueueSnapshot snapshot) {
        selection.onListChanged(QueueKind.INCOMING, snapshot.incoming());
        selection.onListChanged(QueueKind.BATCH, snapshot.batch());
        publish();
    }

    private void publish() {
        if (listeners.isEmpty()) {
            return;
        }
        CoreSnapshot snapshot = captureSnapshot();
        for (CoreListener listener : listeners) {
            try {
                listener.onStateChanged(snapshot);
            } catch (RuntimeException e) {
                LOG.warn("State listener failed: {}", e.getMessage(), e);
            }
        }
    }

    private CoreSnapshot captureSnapshot() {
        List<ReviewItem> batch = store.batch();
        Map<String, ChainInfo> batchChains = new LinkedHashMap<>();
        for (ReviewItem item : batch) {
            ChainInfo info = chains.get(item.restId());
            if (info != null) {
                batchChains.put(item.restId(), info);
            }
        }
        return new CoreSnapshot(
                store.incoming(),
                batch,
                selection.snapshot(),
                server.state(),
                server.port(),
                labels == null ? List.of() : labels,
                batchChains
        );
    }

    private void audit(String action, String actor, String resource, String result, Map<String, Object> details) {
        if (audit == null) {
            return;
        }
        try {
            audit.log(AuditLogger.AuditEvent.of(action, actor, resource, result, details));
        } catch (RuntimeException e) {
            LOG.warn("Audit write failed for {}: {}", action, e.getMessage());
        }
    }

    private <T> CompletableFuture<T> onOwner(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, owner);
    }

    @FunctionalInterface
    private interface GatewayCall {
        CompletableFuture<SubmissionReport> run(HumanConfirmation confirmation, List<ReviewItem> items);
    }

    /**
     * Automation's view of the core: staging and reads only.
     */
    private final class AutomationAccess implements BatchAccess {
        @Override
        public CompletableFuture<List<ReviewItem>> batchSnapshot() {
            return onOwner(store::batch);
        }

        @Override
        public CompletableFuture<List<ReviewItem>> incomingSnapshot() {
            return onOwner(store::incoming);
        }

        @Override
        public CompletableFuture<List<ReviewItem>> addToBatch(BatchAddRequest request) {
            return onOwner(() -> {
                AddOutcome outcome = addNow(request.ids(), request.severities(), null);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("requested", request.ids());
                details.put("added", outcome.added());
                audit("automation.batch.add", AUTOMATION, "batch", "ok", details);
                return store.batch();
            });
        }

        @Override
        public CompletableFuture<List<ReviewItem>> clearBatch() {
            return onOwner(() -> {
                List<String> cleared = clearNow();
                audit("automation.batch.clear", AUTOMATION, "batch", "ok", Map.of("cleared", cleared));
                return store.batch();
            });
        }
    }

    /**
     * Queue effects requested by the submission gateway, applied on the owner thread.
     */
    private final class QueueHandle implements BatchQueueHandle {
        @Override
        public CompletableFuture<List<ReviewItem>> batch() {
            return onOwner(store::batch);
        }

        @Override
        public CompletableFuture<Void> discard(List<String> restIds) {
            return onOwner(() -> {
                if (!restIds.isEmpty()) {
                    forgetChains(store.discardFromBatch(restIds));
                }
                return null;
            });
        }

        @Override
        public CompletableFuture<Void> markApproved(String restId) {
            return onOwner(() -> {
                store.updateItem(restId, item -> item.withApprovingVote(true));
                return null;
            });
        }

        @Override
        public CompletableFuture<Void> markSkipped(String restId, String reason) {
            return onOwner(() -> {
                store.updateItem(restId, item -> item.withSubmittable(false).withSkipReason(reason));
                return null;
            });
        }
    }
}
