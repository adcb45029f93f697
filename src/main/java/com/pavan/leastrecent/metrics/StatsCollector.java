package com.pavan.leastrecent.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts reads, writes and evictions of a single cache.
 * Counters are atomic so they can be read from a monitoring thread while the cache is in use.
 */
public class StatsCollector {
    
    // Read counters
    private final AtomicLong totalGets;
    private final AtomicLong cacheHits;
    private final AtomicLong cacheMisses;
    
    // Write counters
    private final AtomicLong totalSets;
    private final AtomicLong overwrites;
    private final AtomicLong evictions;
    private final AtomicLong clears;
    
    private final long startTime;
    
    public StatsCollector() {
        this.totalGets = new AtomicLong(0);
        this.cacheHits = new AtomicLong(0);
        this.cacheMisses = new AtomicLong(0);
        this.totalSets = new AtomicLong(0);
        this.overwrites = new AtomicLong(0);
        this.evictions = new AtomicLong(0);
        this.clears = new AtomicLong(0);
        this.startTime = System.currentTimeMillis();
    }
    
    public void recordGet(boolean hit) {
        totalGets.incrementAndGet();
        if (hit) {
            cacheHits.incrementAndGet();
        } else {
            cacheMisses.incrementAndGet();
        }
    }
    
    public void recordSet() {
        totalSets.incrementAndGet();
    }
    
    public void recordOverwrite() {
        overwrites.incrementAndGet();
    }
    
    public void recordEviction() {
        evictions.incrementAndGet();
    }
    
    public void recordClear() {
        clears.incrementAndGet();
    }
    
    public long getTotalGets() {
        return totalGets.get();
    }
    
    public long getCacheHits() {
        return cacheHits.get();
    }
    
    public long getCacheMisses() {
        return cacheMisses.get();
    }
    
    public long getTotalSets() {
        return totalSets.get();
    }
    
    public long getOverwrites() {
        return overwrites.get();
    }
    
    public long getEvictions() {
        return evictions.get();
    }
    
    public long getClears() {
        return clears.get();
    }
    
    public double getHitRate() {
        long hits = cacheHits.get();
        long total = hits + cacheMisses.get();
        return total == 0 ? 0.0 : (double) hits / total;
    }
    
    public long getUptimeMillis() {
        return System.currentTimeMillis() - startTime;
    }
    
    /**
     * Returns a snapshot of current statistics.
     */
    public StatsSnapshot getSnapshot() {
        return new StatsSnapshot(
            totalGets.get(),
            cacheHits.get(),
            cacheMisses.get(),
            totalSets.get(),
            overwrites.get(),
            evictions.get(),
            clears.get(),
            getUptimeMillis()
        );
    }
    
    /**
     * Resets all counters. Uptime keeps counting from construction.
     */
    public void reset() {
        totalGets.set(0);
        cacheHits.set(0);
        cacheMisses.set(0);
        totalSets.set(0);
        overwrites.set(0);
        evictions.set(0);
        clears.set(0);
    }
    
    @Override
    public String toString() {
        return String.format(
            "StatsCollector{gets=%d, hits=%d, misses=%d, hitRate=%.2f%%, " +
            "sets=%d, overwrites=%d, evictions=%d, clears=%d}",
            totalGets.get(), cacheHits.get(), cacheMisses.get(), getHitRate() * 100,
            totalSets.get(), overwrites.get(), evictions.get(), clears.get()
        );
    }
    
    /**
     * Immutable snapshot of statistics at a point in time.
     */
    public static class StatsSnapshot {
        public final long totalGets;
        public final long cacheHits;
        public final long cacheMisses;
        public final long totalSets;
        public final long overwrites;
        public final long evictions;
        public final long clears;
        public final long uptimeMillis;
        
        public StatsSnapshot(long totalGets, long cacheHits, long cacheMisses, long totalSets,
                           long overwrites, long evictions, long clears, long uptimeMillis) {
            this.totalGets = totalGets;
            this.cacheHits = cacheHits;
            this.cacheMisses = cacheMisses;
            this.totalSets = totalSets;
            this.overwrites = overwrites;
            this.evictions = evictions;
            this.clears = clears;
            this.uptimeMillis = uptimeMillis;
        }
        
        public double getHitRate() {
            long total = cacheHits + cacheMisses;
            return total == 0 ? 0.0 : (double) cacheHits / total;
        }
        
        /**
         * Sets that claimed a free slot: neither overwrote a key nor evicted one.
         */
        public long getInsertions() {
            return totalSets - overwrites - evictions;
        }
        
        @Override
        public String toString() {
            return String.format(
                "StatsSnapshot{gets=%d, hitRate=%.2f%%, sets=%d, overwrites=%d, evictions=%d, uptime=%dms}",
                totalGets, getHitRate() * 100, totalSets, overwrites, evictions, uptimeMillis
            );
        }
    }
}
