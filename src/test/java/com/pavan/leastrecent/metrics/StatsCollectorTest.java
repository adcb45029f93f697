package com.pavan.leastrecent.metrics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatsCollectorTest {
    
    private StatsCollector stats;
    
    @BeforeEach
    void setUp() {
        stats = new StatsCollector();
    }
    
    @Test
    void testHitRateWithoutReads() {
        assertEquals(0.0, stats.getHitRate());
        assertEquals(0.0, stats.getSnapshot().getHitRate());
    }
    
    @Test
    void testRecordGet() {
        stats.recordGet(true);
        stats.recordGet(true);
        stats.recordGet(false);
        
        assertEquals(3, stats.getTotalGets());
        assertEquals(2, stats.getCacheHits());
        assertEquals(1, stats.getCacheMisses());
        assertEquals(2.0 / 3, stats.getHitRate(), 0.0001);
    }
    
    @Test
    void testSnapshotIsImmutable() {
        stats.recordSet();
        StatsCollector.StatsSnapshot snapshot = stats.getSnapshot();
        
        stats.recordSet();
        stats.recordEviction();
        
        assertEquals(1, snapshot.totalSets);
        assertEquals(0, snapshot.evictions);
        assertEquals(2, stats.getTotalSets());
    }
    
    @Test
    void testReset() {
        stats.recordSet();
        stats.recordOverwrite();
        stats.recordEviction();
        stats.recordClear();
        stats.recordGet(true);
        
        stats.reset();
        
        assertEquals(0, stats.getTotalSets());
        assertEquals(0, stats.getOverwrites());
        assertEquals(0, stats.getEvictions());
        assertEquals(0, stats.getClears());
        assertEquals(0, stats.getTotalGets());
        assertTrue(stats.getUptimeMillis() >= 0);
    }
    
    @Test
    void testToString() {
        stats.recordGet(true);
        stats.recordGet(false);
        
        String text = stats.toString();
        assertTrue(text.contains("gets=2"));
        assertTrue(text.contains("hits=1"));
        assertTrue(text.contains("misses=1"));
    }
}
