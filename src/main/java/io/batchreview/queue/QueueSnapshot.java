package io.batchreview.queue;

import io.batchreview.model.ReviewItem;

import java.util.List;

public record QueueSnapshot(List<ReviewItem> incoming, List<ReviewItem> batch) {
    public QueueSnapshot {
        incoming = List.copyOf(incoming);
        batch = List.copyOf(batch);
    }
}
