package io.batchreview.chain;

import io.batchreview.backend.ReviewBackend;
import io.batchreview.model.ChainInfo;
import io.batchreview.model.ChangeDetail;
import io.batchreview.model.ChangeStatus;
import io.batchreview.model.RelatedChange;
import io.batchreview.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Determines whether a change belongs to an active relation chain and where.
 *
 * <p>Merged members are excluded before counting: they are done and neither block nor count
 * against the chain. Position 1 is the earliest unmerged ancestor. Any backend failure degrades
 * the answer to {@link ChainInfo#standalone()} for that change only. Degraded answers are not
 * cached so a later lookup retries; that includes a chain whose member status or base number
 * could not be fetched, since its position may count a merged ancestor.
 *
 * <p>Chain membership is treated as stable for the session: a dependent pushed after the first
 * lookup is not seen until the cache is cleared.
 */
public final class ChainResolver {
    private static final Logger LOG = LoggerFactory.getLogger(ChainResolver.class);

    private final ReviewBackend backend;
    private final ChainInfoCache cache;
    private final ConcurrentMap<String, CompletableFuture<ChainInfo>> inFlight;

    public ChainResolver(ReviewBackend backend, ChainInfoCache cache) {
        this.backend = backend;
        this.cache = cache;
        this.inFlight = new ConcurrentHashMap<>();
    }

    /**
     * Resolves by dependency identifier. Concurrent lookups of the same identifier share one
     * backend round trip. The returned future never completes exceptionally.
     */
    public CompletableFuture<ChainInfo> chainInfo(String vcsId) {
        if (vcsId == null || vcsId.isBlank()) {
            return CompletableFuture.completedFuture(ChainInfo.standalone());
        }
        Optional<ChainInfo> cached = cache.get(vcsId);
        if (cached.isPresent()) {
            return CompletableFuture.completedFuture(cached.get());
        }
        CompletableFuture<ChainInfo> created = new CompletableFuture<>();
        CompletableFuture<ChainInfo> existing = inFlight.putIfAbsent(vcsId, created);
        if (existing != null) {
            return existing;
        }
        AtomicBoolean degraded = new AtomicBoolean();
        CompletableFuture<ChainInfo> lookup;
        try {
            lookup = resolve(vcsId, degraded);
        } catch (RuntimeException e) {
            lookup = CompletableFuture.failedFuture(e);
        }
        lookup.whenComplete((info, error) -> {
            inFlight.remove(vcsId, created);
            if (error != null) {
                LOG.warn("Chain lookup failed for {}, treating as standalone: {}", vcsId, Failures.rootMessage(error));
                created.complete(ChainInfo.standalone());
                return;
            }
            if (!degraded.get()) {
                cache.put(vcsId, info);
            }
            created.complete(info);
        });
        return created;
    }

    /**
     * Resolves a change addressed by its REST identifier: one extra round trip maps it to its
     * dependency identifier first.
     */
    public CompletableFuture<ChainInfo> chainInfoForChange(String restId) {
        return backend.changeDetail(restId)
                .thenCompose(detail -> chainInfo(detail.vcsId()))
                .exceptionally(error -> {
                    LOG.warn("Could not resolve dependency id of {}: {}", restId, Failures.rootMessage(error));
                    return ChainInfo.standalone();
                });
    }

    public Optional<ChainInfo> cached(String vcsId) {
        return vcsId == null ? Optional.empty() : cache.get(vcsId);
    }

    public void clearSession() {
        cache.clear();
    }

    private CompletableFuture<ChainInfo> resolve(String vcsId, AtomicBoolean degraded) {
        return backend.relatedChain(vcsId).thenCompose(related -> {
            if (related == null || related.size() < 2) {
                return CompletableFuture.completedFuture(ChainInfo.standalone());
            }
            return withStatuses(related, degraded).thenCompose(members -> position(vcsId, members, degraded));
        });
    }

    /**
     * Fills in the lifecycle status of members the relation graph did not report. A member
     * whose status cannot be fetched is kept as active and marks the lookup degraded.
     */
    private CompletableFuture<List<RelatedChange>> withStatuses(List<RelatedChange> related, AtomicBoolean degraded) {
        List<CompletableFuture<RelatedChange>> lookups = new ArrayList<>(related.size());
        for (RelatedChange member : related) {
            if (member.status() != ChangeStatus.UNKNOWN) {
                lookups.add(CompletableFuture.completedFuture(member));
                continue;
            }
            lookups.add(backend.changeDetail(member.vcsId())
                    .thenApply(detail -> new RelatedChange(
                            member.commit(),
                            member.vcsId(),
                            detail.status(),
                            member.number() > 0 ? member.number() : detail.number()
                    ))
                    .exceptionally(error -> {
                        LOG.warn("Status lookup failed for chain member {}: {}", member.vcsId(), Failures.rootMessage(error));
                        degraded.set(true);
                        return member;
                    }));
        }
        return CompletableFuture.allOf(lookups.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<RelatedChange> out = new ArrayList<>(lookups.size());
                    for (CompletableFuture<RelatedChange> lookup : lookups) {
                        out.add(lookup.join());
                    }
                    return out;
                });
    }

    private CompletableFuture<ChainInfo> position(String vcsId, List<RelatedChange> members, AtomicBoolean degraded) {
        // Relation graphs are reported tip first, so the base is the last active member.
        List<RelatedChange> active = new ArrayList<>();
        for (RelatedChange member : members) {
            if (member.status() != ChangeStatus.MERGED) {
                active.add(member);
            }
        }
        int index = -1;
        for (int i = 0; i < active.size(); i++) {
            if (vcsId.equals(active.get(i).vcsId())) {
                index = i;
                break;
            }
        }
        if (active.size() < 2 || index < 0) {
            return CompletableFuture.completedFuture(ChainInfo.standalone());
        }
        int length = active.size();
        int position = length - index;
        RelatedChange base = active.get(length - 1);
        if (base.number() > 0) {
            return CompletableFuture.completedFuture(ChainInfo.of(position, length, base.vcsId(), base.number()));
        }
        return backend.changeDetail(base.vcsId())
                .thenApply(ChangeDetail::number)
                .exceptionally(error -> {
                    LOG.warn("Base number lookup failed for {}: {}", base.vcsId(), Failures.rootMessage(error));
                    degraded.set(true);
                    return 0;
                })
                .thenApply(number -> ChainInfo.of(position, length, base.vcsId(), number));
    }
}
