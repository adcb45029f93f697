package com.pavan.leastrecent.cache;

/**
 * Thrown when a capacity is valid but larger than the cache can address.
 */
public class CapacityUnsupportedException extends IllegalArgumentException {
    
    public CapacityUnsupportedException(String message) {
        super(message);
    }
}
