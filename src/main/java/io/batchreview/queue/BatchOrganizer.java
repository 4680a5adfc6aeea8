package io.batchreview.queue;

import io.batchreview.chain.ChainResolver;
import io.batchreview.model.ChainInfo;
import io.batchreview.model.ReviewItem;
import io.batchreview.model.Severity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Computes the submission order of the Batch.
 *
 * <p>Members of one relation chain are kept together, base first, so a dependent never reaches
 * the server before its base. Units (a standalone item or a whole chain) are ordered by severity
 * priority, highest first; a chain ranks at the highest severity among its members. At equal
 * priority standalone items come before chains, and otherwise the incoming order is kept.
 */
public final class BatchOrganizer {
    private final ChainResolver chainResolver;

    public BatchOrganizer(ChainResolver chainResolver) {
        this.chainResolver = chainResolver;
    }

    /**
     * Resolves the chain position of every item in parallel. The result is keyed by restId and
     * never completes exceptionally: a failed lookup reads as standalone.
     */
    public CompletableFuture<Map<String, ChainInfo>> resolveChains(List<ReviewItem> batch) {
        List<ReviewItem> items = List.copyOf(batch);
        List<CompletableFuture<ChainInfo>> lookups = new ArrayList<>(items.size());
        for (ReviewItem item : items) {
            lookups.add(chainResolver.chainInfo(item.vcsId()));
        }
        return CompletableFuture.allOf(lookups.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    Map<String, ChainInfo> out = new LinkedHashMap<>();
                    for (int i = 0; i < items.size(); i++) {
                        out.put(items.get(i).restId(), lookups.get(i).join());
                    }
                    return out;
                });
    }

    /**
     * Resolves chains and returns the organized order of {@code batch}.
     */
    public CompletableFuture<List<ReviewItem>> organizeAsync(List<ReviewItem> batch) {
        List<ReviewItem> items = List.copyOf(batch);
        return resolveChains(items).thenApply(chains -> organize(items, chains));
    }

    public static List<ReviewItem> organize(List<ReviewItem> batch, Map<String, ChainInfo> chains) {
        List<Unit> units = new ArrayList<>();
        Map<String, Unit> chainUnits = new LinkedHashMap<>();
        for (ReviewItem item : batch) {
            ChainInfo chain = chains.getOrDefault(item.restId(), ChainInfo.standalone());
            if (!chain.inChain() || chain.chainBaseId() == null) {
                Unit unit = new Unit(false);
                unit.add(item, 0);
                units.add(unit);
                continue;
            }
            Unit unit = chainUnits.get(chain.chainBaseId());
            if (unit == null) {
                unit = new Unit(true);
                chainUnits.put(chain.chainBaseId(), unit);
                units.add(unit);
            }
            unit.add(item, chain.position());
        }
        units.sort(Comparator.comparingInt(Unit::priority).reversed()
                .thenComparing(unit -> unit.chain));
        List<ReviewItem> out = new ArrayList<>(batch.size());
        for (Unit unit : units) {
            out.addAll(unit.ordered());
        }
        return out;
    }

    public static boolean sameOrder(List<ReviewItem> left, List<ReviewItem> right) {
        return ChangeQueueStore.sameOrder(left, right);
    }

    private static final class Unit {
        private final boolean chain;
        private final List<ReviewItem> items;
        private final List<Integer> positions;
        private int priority;

        private Unit(boolean chain) {
            this.chain = chain;
            this.items = new ArrayList<>();
            this.positions = new ArrayList<>();
        }

        private void add(ReviewItem item, int position) {
            items.add(item);
            positions.add(position);
            priority = Math.max(priority, Severity.priorityOf(item.severity()));
        }

        private int priority() {
            return priority;
        }

        private List<ReviewItem> ordered() {
            if (!chain) {
                return items;
            }
            List<Integer> order = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                order.add(i);
            }
            order.sort(Comparator.comparingInt(positions::get));
            List<ReviewItem> out = new ArrayList<>(items.size());
            for (Integer index : order) {
                out.add(items.get(index));
            }
            return out;
        }
    }
}
