package io.batchreview.chain;

import io.batchreview.model.ChainInfo;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChainInfoCacheTest {
    @Test
    void evictsLeastRecentlyUsedEntry() {
        ChainInfoCache cache = new ChainInfoCache(2);
        cache.put("A", ChainInfo.of(1, 2, "A", 1));
        cache.put("B", ChainInfo.of(2, 2, "A", 1));
        cache.get("A");
        cache.put("C", ChainInfo.standalone());

        assertEquals(2, cache.size());
        assertTrue(cache.get("A").isPresent());
        assertTrue(cache.get("B").isEmpty());
        assertTrue(cache.get("C").isPresent());
    }

    @Test
    void ignoresBlankKeysAndRejectsZeroCapacity() {
        ChainInfoCache cache = new ChainInfoCache(4);
        cache.put(" ", ChainInfo.standalone());
        cache.put("A", null);

        assertEquals(0, cache.size());
        assertThrows(IllegalArgumentException.class, () -> new ChainInfoCache(0));
    }
}
