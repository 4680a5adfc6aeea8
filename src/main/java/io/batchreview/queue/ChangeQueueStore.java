package io.batchreview.queue;

import io.batchreview.model.QueueKind;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.Severity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;

/**
 * Owns the Incoming and Batch queues.
 *
 * <p>A {@code restId} lives in at most one queue and at most once inside it; every mutation
 * path below checks membership before inserting. The store is not thread-safe: the
 * orchestration core calls it from its owner thread only. Listeners are notified after every
 * mutation call, on the calling thread.
 */
public final class ChangeQueueStore {
    private final List<ReviewItem> incoming;
    private final List<ReviewItem> batch;
    private final List<QueueListener> listeners;

    public ChangeQueueStore() {
        this.incoming = new ArrayList<>();
        this.batch = new ArrayList<>();
        this.listeners = new CopyOnWriteArrayList<>();
    }

    public void addListener(QueueListener listener) {
        listeners.add(listener);
    }

    public void removeListener(QueueListener listener) {
        listeners.remove(listener);
    }

    /**
     * Moves the Incoming items named by {@code ids} into the Batch. Ids that are not in
     * Incoming, or already in the Batch, are ignored. Moved items keep their Incoming order.
     *
     * @param severities optional severity per restId, applied to moved items
     * @param insertAt   optional Batch index; null or negative appends
     */
    public AddOutcome addToBatch(Collection<String> ids, Map<String, Severity> severities, Integer insertAt) {
        boolean wasEmpty = batch.isEmpty();
        Set<String> wanted = normalize(ids);
        List<ReviewItem> moving = new ArrayList<>();
        for (ReviewItem item : incoming) {
            if (wanted.contains(item.restId()) && indexOf(batch, item.restId()) < 0) {
                Severity severity = severities == null ? null : severities.get(item.restId());
                moving.add(severity == null ? item : item.withSeverity(severity));
            }
        }
        List<String> added = new ArrayList<>(moving.size());
        for (ReviewItem item : moving) {
            added.add(item.restId());
        }
        incoming.removeIf(item -> wanted.contains(item.restId()));
        insert(batch, moving, insertAt);
        notifyListeners();
        return new AddOutcome(added, wasEmpty);
    }

    /**
     * Moves Batch items back to Incoming with their Batch-only badges cleared.
     */
    public List<String> removeFromBatch(Collection<String> ids, Integer insertAt) {
        Set<String> wanted = normalize(ids);
        List<ReviewItem> moving = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (ReviewItem item : batch) {
            if (wanted.contains(item.restId())) {
                removed.add(item.restId());
                if (indexOf(incoming, item.restId()) < 0) {
                    moving.add(item.withoutBatchBadges());
                }
            }
        }
        batch.removeIf(item -> wanted.contains(item.restId()));
        insert(incoming, moving, insertAt);
        notifyListeners();
        return removed;
    }

    public List<String> clearBatch() {
        List<String> ids = new ArrayList<>(batch.size());
        for (ReviewItem item : batch) {
            ids.add(item.restId());
            if (indexOf(incoming, item.restId()) < 0) {
                incoming.add(item.withoutBatchBadges());
            }
        }
        batch.clear();
        notifyListeners();
        return ids;
    }

    /**
     * Moves the named items of one queue to {@code dropIndex}, where {@code dropIndex} is a
     * position in the queue as it is before the move. Items not being moved keep their relative
     * order, and so do the moved items.
     *
     * @return whether the order changed
     */
    public boolean reorder(Collection<String> ids, QueueKind target, int dropIndex) {
        List<ReviewItem> queue = queue(target);
        Set<String> movingIds = normalize(ids);
        List<ReviewItem> moving = new ArrayList<>();
        List<ReviewItem> remaining = new ArrayList<>();
        for (ReviewItem item : queue) {
            if (movingIds.contains(item.restId())) {
                moving.add(item);
            } else {
                remaining.add(item);
            }
        }
        if (moving.isEmpty()) {
            notifyListeners();
            return false;
        }
        int limit = Math.min(Math.max(dropIndex, 0), queue.size());
        int adjusted = 0;
        for (int i = 0; i < limit; i++) {
            if (!movingIds.contains(queue.get(i).restId())) {
                adjusted++;
            }
        }
        List<ReviewItem> next = new ArrayList<>(queue.size());
        next.addAll(remaining.subList(0, adjusted));
        next.addAll(moving);
        next.addAll(remaining.subList(adjusted, remaining.size()));
        boolean changed = !sameOrder(queue, next);
        queue.clear();
        queue.addAll(next);
        notifyListeners();
        return changed;
    }

    /**
     * Replaces Incoming with a fresh fetch. Items already staged in the Batch are left out.
     */
    public int replaceIncoming(List<ReviewItem> items) {
        incoming.clear();
        Set<String> seen = new LinkedHashSet<>();
        for (ReviewItem item : items) {
            if (item == null || indexOf(batch, item.restId()) >= 0 || !seen.add(item.restId())) {
                continue;
            }
            incoming.add(item);
        }
        notifyListeners();
        return incoming.size();
    }

    /**
     * Applies a new Batch order computed elsewhere. The proposal must be a permutation of the
     * current Batch; anything else is stale and rejected. Listeners are notified only when the
     * order actually changes.
     */
    public boolean applyBatchOrder(List<ReviewItem> proposed) {
        if (proposed.size() != batch.size() || sameOrder(batch, proposed)) {
            return false;
        }
        Set<String> current = new LinkedHashSet<>();
        for (ReviewItem item : batch) {
            current.add(item.restId());
        }
        List<ReviewItem> next = new ArrayList<>(proposed.size());
        for (ReviewItem item : proposed) {
            if (!current.remove(item.restId())) {
                return false;
            }
            // Keep the stored instance: it may carry updates newer than the proposal.
            next.add(batch.get(indexOf(batch, item.restId())));
        }
        batch.clear();
        batch.addAll(next);
        notifyListeners();
        return true;
    }

    /**
     * Drops items from the Batch without returning them to Incoming (they were acted on).
     */
    public List<String> discardFromBatch(Collection<String> ids) {
        Set<String> wanted = normalize(ids);
        List<String> removed = new ArrayList<>();
        for (ReviewItem item : batch) {
            if (wanted.contains(item.restId())) {
                removed.add(item.restId());
            }
        }
        batch.removeIf(item -> wanted.contains(item.restId()));
        notifyListeners();
        return removed;
    }

    /**
     * Replaces one item, wherever it is, with {@code update.apply(item)}. The restId must not
     * change.
     */
    public boolean updateItem(String restId, UnaryOperator<ReviewItem> update) {
        for (List<ReviewItem> queue : List.of(incoming, batch)) {
            int index = indexOf(queue, restId);
            if (index >= 0) {
                ReviewItem updated = update.apply(queue.get(index));
                if (!restId.equals(updated.restId())) {
                    throw new IllegalArgumentException("Update must keep restId " + restId);
                }
                queue.set(index, updated);
                notifyListeners();
                return true;
            }
        }
        return false;
    }

    public Optional<ReviewItem> find(String restId) {
        for (List<ReviewItem> queue : List.of(incoming, batch)) {
            int index = indexOf(queue, restId);
            if (index >= 0) {
                return Optional.of(queue.get(index));
            }
        }
        return Optional.empty();
    }

    public Optional<QueueKind> locate(String restId) {
        if (indexOf(incoming, restId) >= 0) {
            return Optional.of(QueueKind.INCOMING);
        }
        if (indexOf(batch, restId) >= 0) {
            return Optional.of(QueueKind.BATCH);
        }
        return Optional.empty();
    }

    public List<ReviewItem> incoming() {
        return List.copyOf(incoming);
    }

    public List<ReviewItem> batch() {
        return List.copyOf(batch);
    }

    public List<ReviewItem> items(QueueKind kind) {
        return List.copyOf(queue(kind));
    }

    public List<String> ids(QueueKind kind) {
        List<ReviewItem> queue = queue(kind);
        List<String> out = new ArrayList<>(queue.size());
        for (ReviewItem item : queue) {
            out.add(item.restId());
        }
        return out;
    }

    public QueueSnapshot snapshot() {
        return new QueueSnapshot(incoming, batch);
    }

    public static boolean sameOrder(List<ReviewItem> left, List<ReviewItem> right) {
        if (left.size() != right.size()) {
            return false;
        }
        for (int i = 0; i < left.size(); i++) {
            if (!left.get(i).restId().equals(right.get(i).restId())) {
                return false;
            }
        }
        return true;
    }

    private List<ReviewItem> queue(QueueKind kind) {
        return kind == QueueKind.BATCH ? batch : incoming;
    }

    private void notifyListeners() {
        if (listeners.isEmpty()) {
            return;
        }
        QueueSnapshot snapshot = snapshot();
        for (QueueListener listener : listeners) {
            listener.onQueuesChanged(snapshot);
        }
    }

    private static void insert(List<ReviewItem> target, List<ReviewItem> items, Integer insertAt) {
        if (items.isEmpty()) {
            return;
        }
        if (insertAt == null || insertAt < 0) {
            target.addAll(items);
            return;
        }
        target.addAll(Math.min(insertAt, target.size()), items);
    }

    private static int indexOf(List<ReviewItem> queue, String restId) {
        for (int i = 0; i < queue.size(); i++) {
            if (queue.get(i).restId().equals(restId)) {
                return i;
            }
        }
        return -1;
    }

    private static Set<String> normalize(Collection<String> ids) {
        Set<String> out = new LinkedHashSet<>();
        if (ids == null) {
            return out;
        }
        for (String id : ids) {
            if (id != null && !id.isBlank()) {
                out.add(id);
            }
        }
        return out;
    }
}
