package io.batchreview.queue;

import io.batchreview.model.QueueKind;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.batchreview.backend.FakeReviewBackend.item;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class ChangeQueueStoreTest {

    @Test
    void addToBatchMovesItemsAndAppliesSeverity() {
        ChangeQueueStore store = storeWith("A", "B", "C");

        AddOutcome outcome = store.addToBatch(List.of("A", "B"), Map.of("A", Severity.CRITICAL), null);

        assertEquals(List.of("A", "B"), outcome.added());
        assertTrue(outcome.batchWasEmpty());
        assertEquals(List.of("C"), store.ids(QueueKind.INCOMING));
        assertEquals(List.of("A", "B"), store.ids(QueueKind.BATCH));
        assertEquals(Severity.CRITICAL, store.batch().get(0).severity());
        assertNull(store.batch().get(1).severity());
    }

    @Test
    void addingStagedOrUnknownIdsIsANoOp() {
        ChangeQueueStore store = storeWith("A", "B");
        store.addToBatch(List.of("A"), Map.of(), null);

        AddOutcome again = store.addToBatch(List.of("A", "missing"), Map.of(), null);

        assertFalse(again.changed());
        assertFalse(again.batchWasEmpty());
        assertEquals(List.of("A"), store.ids(QueueKind.BATCH));
        assertEquals(List.of("B"), store.ids(QueueKind.INCOMING));
    }

    @Test
    void addToBatchHonorsInsertIndex() {
        ChangeQueueStore store = storeWith("A", "B", "C");
        store.addToBatch(List.of("A", "B"), Map.of(), null);

        store.addToBatch(List.of("C"), Map.of(), 1);

        assertEquals(List.of("A", "C", "B"), store.ids(QueueKind.BATCH));
    }

    @Test
    void removeFromBatchClearsBadges() {
        ChangeQueueStore store = storeWith("A");
        store.addToBatch(List.of("A"), Map.of("A", Severity.HIGH), null);
        store.updateItem("A", item -> item.withSubmittable(true).withSkipReason("blocked"));

        List<String> removed = store.removeFromBatch(List.of("A"), 0);

        assertEquals(List.of("A"), removed);
        ReviewItem back = store.incoming().get(0);
        assertNull(back.severity());
        assertFalse(back.submittable());
        assertNull(back.skipReason());
    }

    @Test
    void clearBatchReturnsEveryItemExactlyOnce() {
        ChangeQueueStore store = storeWith("A", "B", "C");
        store.addToBatch(List.of("A", "C"), Map.of("C", Severity.LOW), null);

        List<String> cleared = store.clearBatch();

        assertEquals(List.of("A", "C"), cleared);
        assertTrue(store.batch().isEmpty());
        assertEquals(List.of("B", "A", "C"), store.ids(QueueKind.INCOMING));
        for (ReviewItem item : store.incoming()) {
            assertNull(item.severity());
        }
    }

    @Test
    void reorderMovesSelectionToDropIndex() {
        ChangeQueueStore store = storeWith("A", "B", "C", "D", "E");

        assertTrue(store.reorder(List.of("B", "D"), QueueKind.INCOMING, 5));
        assertEquals(List.of("A", "C", "E", "B", "D"), store.ids(QueueKind.INCOMING));

        assertTrue(store.reorder(List.of("E", "D"), QueueKind.INCOMING, 1));
        assertEquals(List.of("A", "E", "D", "C", "B"), store.ids(QueueKind.INCOMING));
    }

    @Test
    void reorderCountsOnlyStationaryItemsBeforeDropIndex() {
        ChangeQueueStore store = storeWith("A", "B", "C", "D");

        // Drop index 3 sits before D in the original list; A and C precede it once B moves.
        store.reorder(List.of("B"), QueueKind.INCOMING, 3);

        assertEquals(List.of("A", "C", "B", "D"), store.ids(QueueKind.INCOMING));
    }

    @Test
    void reorderOntoItselfReportsNoChange() {
        ChangeQueueStore store = storeWith("A", "B", "C");

        assertFalse(store.reorder(List.of("B"), QueueKind.INCOMING, 1));
        assertFalse(store.reorder(List.of("B"), QueueKind.INCOMING, 2));
        assertFalse(store.reorder(List.of("missing"), QueueKind.INCOMING, 0));
        assertEquals(List.of("A", "B", "C"), store.ids(QueueKind.INCOMING));
    }

    @Test
    void replaceIncomingSkipsStagedAndDuplicateItems() {
        ChangeQueueStore store = storeWith("A", "B");
        store.addToBatch(List.of("A"), Map.of(), null);

        int size = store.replaceIncoming(List.of(item("A", 1), item("C", 3), item("C", 3), item("B", 2)));

        assertEquals(2, size);
        assertEquals(List.of("C", "B"), store.ids(QueueKind.INCOMING));
        assertEquals(List.of("A"), store.ids(QueueKind.BATCH));
    }

    @Test
    void applyBatchOrderRejectsStaleProposals() {
        ChangeQueueStore store = storeWith("A", "B", "C");
        store.addToBatch(List.of("A", "B"), Map.of(), null);

        assertFalse(store.applyBatchOrder(List.of(item("B", 2), item("C", 3))));
        assertFalse(store.applyBatchOrder(List.of(item("A", 1), item("B", 2))));
        assertTrue(store.applyBatchOrder(List.of(item("B", 2), item("A", 1))));
        assertEquals(List.of("B", "A"), store.ids(QueueKind.BATCH));
    }

    @Test
    void applyBatchOrderKeepsStoredInstances() {
        ChangeQueueStore store = storeWith("A", "B");
        store.addToBatch(List.of("A", "B"), Map.of("A", Severity.MEDIUM), null);

        store.applyBatchOrder(List.of(item("B", 2), item("A", 1)));

        assertEquals(Severity.MEDIUM, store.batch().get(1).severity());
    }

    @Test
    void discardDoesNotReturnItemsToIncoming() {
        ChangeQueueStore store = storeWith("A", "B", "C");
        store.addToBatch(List.of("A", "B", "C"), Map.of(), null);

        assertEquals(List.of("B"), store.discardFromBatch(List.of("B")));
        assertEquals(List.of("A", "C"), store.discardFromBatch(List.of("C", "A", "Z")));
        assertTrue(store.batch().isEmpty());
        assertTrue(store.incoming().isEmpty());
    }

    @Test
    void updateItemMustKeepRestId() {
        ChangeQueueStore store = storeWith("A");

        assertThrows(IllegalArgumentException.class, () -> store.updateItem("A", ignored -> item("Z", 9)));
        assertFalse(store.updateItem("missing", item -> item));
    }

    @Test
    void listenersSeeEveryMutation() {
        ChangeQueueStore store = storeWith("A", "B");
        List<QueueSnapshot> seen = new ArrayList<>();
        store.addListener(seen::add);

        store.addToBatch(List.of("A"), Map.of(), null);
        store.reorder(List.of("B"), QueueKind.INCOMING, 0);
        store.clearBatch();

        assertEquals(3, seen.size());
        assertTrue(seen.get(2).batch().isEmpty());
    }

    @Test
    void noItemIsEverInBothQueuesOrTwiceInOne() {
        ChangeQueueStore store = storeWith("A", "B", "C", "D", "E");

        store.addToBatch(List.of("A", "C", "C"), Map.of(), null);
        assertDisjointAndUnique(store);
        store.replaceIncoming(List.of(item("A", 1), item("B", 2), item("D", 4), item("E", 5), item("F", 6)));
        assertDisjointAndUnique(store);
        store.removeFromBatch(List.of("C"), 0);
        assertDisjointAndUnique(store);
        store.addToBatch(List.of("F", "C", "B"), Map.of(), 0);
        assertDisjointAndUnique(store);
        store.reorder(List.of("C", "A"), QueueKind.BATCH, 4);
        assertDisjointAndUnique(store);
        store.removeFromBatch(List.of("A", "B"), null);
        assertDisjointAndUnique(store);
        store.clearBatch();
        assertDisjointAndUnique(store);
        assertEquals(6, store.incoming().size());
    }

    private static void assertDisjointAndUnique(ChangeQueueStore store) {
        Set<String> seen = new HashSet<>();
        for (QueueKind kind : List.of(QueueKind.INCOMING, QueueKind.BATCH)) {
            for (String id : store.ids(kind)) {
                assertTrue(seen.add(id), "duplicate id " + id);
            }
        }
    }

    private static ChangeQueueStore storeWith(String... ids) {
        ChangeQueueStore store = new ChangeQueueStore();
        List<ReviewItem> items = new ArrayList<>();
        for (int i = 0; i < ids.length; i++) {
            items.add(item(ids[i], i + 1));
        }
        store.replaceIncoming(items);
        return store;
    }
}
