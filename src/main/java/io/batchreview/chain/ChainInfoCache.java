package io.batchreview.chain;

import io.batchreview.model.ChainInfo;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Session-lifetime cache of resolved chain positions, keyed by the dependency identifier.
 * Entries are never invalidated individually; the least recently used entry is evicted once
 * {@code maxEntries} is reached, and {@link #clear()} ends the session.
 */
public final class ChainInfoCache {
    private final int maxEntries;
    private final LinkedHashMap<String, ChainInfo> entries;

    public ChainInfoCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, ChainInfo> eldest) {
                return size() > ChainInfoCache.this.maxEntries;
            }
        };
    }

    public synchronized Optional<ChainInfo> get(String vcsId) {
        return Optional.ofNullable(entries.get(vcsId));
    }

    public synchronized void put(String vcsId, ChainInfo info) {
        if (vcsId == null || vcsId.isBlank() || info == null) {
            return;
        }
        entries.put(vcsId, info);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
