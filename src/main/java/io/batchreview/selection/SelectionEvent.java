package io.batchreview.selection;

import io.batchreview.model.QueueKind;

/**
 * A click on one row. {@code index} is the row position the presentation layer saw; when it no
 * longer matches {@code restId} the current position of {@code restId} is used instead.
 */
public record SelectionEvent(QueueKind list, String restId, int index, SelectionAction action) {
    public SelectionEvent {
        if (list == null) {
            throw new IllegalArgumentException("list is required");
        }
        if (restId == null || restId.isBlank()) {
            throw new IllegalArgumentException("restId is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("action is required");
        }
    }
}
