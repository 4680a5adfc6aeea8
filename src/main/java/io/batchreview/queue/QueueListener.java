package io.batchreview.queue;

@FunctionalInterface
public interface QueueListener {
    void onQueuesChanged(QueueSnapshot snapshot);
}
