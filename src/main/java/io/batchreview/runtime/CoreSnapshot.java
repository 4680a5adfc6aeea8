package io.batchreview.runtime;

import io.batchreview.model.ChainInfo;
import io.batchreview.model.LabelInfo;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.ServerState;
import io.batchreview.selection.SelectionSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Everything the presentation layer renders, captured at one point on the owner thread.
 * {@code chains} holds the known chain position of Batch items by restId.
 */
public record CoreSnapshot(
        List<ReviewItem> incoming,
        List<ReviewItem> batch,
        SelectionSnapshot selection,
        ServerState serverState,
        int serverPort,
        List<LabelInfo> labels,
        Map<String, ChainInfo> chains
) {
    public CoreSnapshot {
        incoming = List.copyOf(incoming);
        batch = List.copyOf(batch);
        labels = List.copyOf(labels);
        chains = Map.copyOf(chains);
    }
}
