package com.pavan.leastrecent.cache;

/**
 * Thrown when a cache is constructed with a capacity that is not a finite positive integer.
 */
public class InvalidCapacityException extends IllegalArgumentException {
    
    public InvalidCapacityException(String message) {
        super(message);
    }
}
