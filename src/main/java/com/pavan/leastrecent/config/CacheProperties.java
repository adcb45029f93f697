package com.pavan.leastrecent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the auto-configured cache, bound from {@code least-recent.cache.*}.
 */
@ConfigurationProperties(prefix = "least-recent.cache")
public class CacheProperties {
    
    private int capacity = 1000;
    
    /**
     * Subscribes a listener that logs every eviction at DEBUG level.
     */
    private boolean logEvictions = false;
    
    public int getCapacity() {
        return capacity;
    }
    
    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }
    
    public boolean isLogEvictions() {
        return logEvictions;
    }
    
    public void setLogEvictions(boolean logEvictions) {
        this.logEvictions = logEvictions;
    }
}
