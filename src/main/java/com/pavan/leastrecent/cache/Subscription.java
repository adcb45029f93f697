package com.pavan.leastrecent.cache;

/**
 * Handle returned when registering an {@link EvictionListener}.
 */
public interface Subscription extends AutoCloseable {
    
    /**
     * Stops delivery to the listener. Calling it more than once has no further effect.
     */
    void unsubscribe();
    
    boolean isActive();
    
    @Override
    default void close() {
        unsubscribe();
    }
}
