package io.batchreview.runtime;

/**
 * Receives a full snapshot after every state change, on the core's owner thread.
 */
public interface CoreListener {
    void onStateChanged(CoreSnapshot snapshot);
}
