package com.pavan.leastrecent.cache;

import com.pavan.leastrecent.metrics.StatsCollector;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LRUCacheStatsTest {
    
    @Test
    void testOperationsAreCounted() {
        LRUCache<String, Integer> cache = new LRUCache<>(2);
        
        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("a", 10);   // overwrite
        cache.set("c", 3);    // evicts b
        cache.get("a");
        cache.get("b");
        cache.peek("c");
        cache.clear();
        
        StatsCollector.StatsSnapshot snapshot = cache.stats().getSnapshot();
        assertEquals(4, snapshot.totalSets);
        assertEquals(1, snapshot.overwrites);
        assertEquals(1, snapshot.evictions);
        assertEquals(2, snapshot.getInsertions());
        assertEquals(2, snapshot.totalGets);
        assertEquals(1, snapshot.cacheHits);
        assertEquals(1, snapshot.cacheMisses);
        assertEquals(1, snapshot.clears);
        assertEquals(0.5, snapshot.getHitRate(), 0.001);
    }
    
    @Test
    void testSharedCollector() {
        StatsCollector shared = new StatsCollector();
        LRUCache<String, Integer> first = new LRUCache<>(1, shared);
        LRUCache<String, Integer> second = new LRUCache<>(1, shared);
        
        first.set("a", 1);
        second.set("a", 1);
        second.set("b", 2);
        
        assertSame(shared, first.stats());
        assertEquals(3, shared.getTotalSets());
        assertEquals(1, shared.getEvictions());
    }
}
