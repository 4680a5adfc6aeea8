package io.batchreview.queue;

import java.util.List;

/**
 * Result of {@link ChangeQueueStore#addToBatch}. {@code batchWasEmpty} reports whether the Batch
 * had no items before the call.
 */
public record AddOutcome(List<String> added, boolean batchWasEmpty) {
    public AddOutcome {
        added = List.copyOf(added);
    }

    public boolean changed() {
        return !added.isEmpty();
    }
}
