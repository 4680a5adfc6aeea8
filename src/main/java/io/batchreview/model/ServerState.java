package io.batchreview.model;

public enum ServerState {
    STOPPED,
    STARTING,
    RUNNING
}
