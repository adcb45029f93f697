package com.pavan.leastrecent.cache;

/**
 * Receives entries displaced from a full cache to make room for a new key.
 * <p>
 * Called synchronously on the thread performing the write, after the new entry is stored.
 * Not called for overwrites of an existing key or for {@link LRUCache#clear()}.
 * Listeners must not modify the cache they are registered on.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
@FunctionalInterface
public interface EvictionListener<K, V> {
    
    void onEvicted(K key, V value);
}
