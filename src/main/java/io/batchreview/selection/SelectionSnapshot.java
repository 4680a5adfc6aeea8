package io.batchreview.selection;

import io.batchreview.model.QueueKind;

public record SelectionSnapshot(ListSelection incoming, ListSelection batch) {
    public ListSelection forList(QueueKind kind) {
        return kind == QueueKind.BATCH ? batch : incoming;
    }
}
