/**
 * Batch review source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.batchreview.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.batchreview.cli.BatchReviewCommand} maps commands to the core and the automation client.</li>
 *   <li>{@code io.batchreview.runtime.BatchReviewCore} owns the queues and serializes every change to them.</li>
 *   <li>{@code io.batchreview.submission.SubmissionGateway} is the only path to bulk vote and submit.</li>
 * </ul>
 */
package io.batchreview;
