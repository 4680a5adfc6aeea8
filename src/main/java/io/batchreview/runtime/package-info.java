/**
 * Orchestration core.
 *
 * <p>{@link io.batchreview.runtime.BatchReviewCore} owns the queues, the selection and the chain
 * knowledge, and serializes every change to them on one owner thread. Remote work (refresh,
 * chain lookups, votes, submissions) runs asynchronously and merges its results back through
 * that thread. The presentation layer talks to it through {@link io.batchreview.runtime.CoreCommand}
 * values and listens for {@link io.batchreview.runtime.CoreSnapshot}s.
 */
package io.batchreview.runtime;
