package com.pavan.leastrecent.cache;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps each live key to the slot holding it.
 * This is the only place that decides whether a key is present.
 *
 * @param <K> the type of keys
 */
final class KeyIndex<K> {
    
    static final int ABSENT = -1;
    
    private final Map<K, Integer> slots;
    
    KeyIndex(int capacity) {
        this.slots = new HashMap<>(capacity);
    }
    
    /**
     * @return the slot of {@code key}, or {@link #ABSENT}
     */
    int lookup(K key) {
        Integer slot = slots.get(key);
        return slot == null ? ABSENT : slot;
    }
    
    boolean contains(K key) {
        return slots.containsKey(key);
    }
    
    void insert(K key, int slot) {
        slots.put(key, slot);
    }
    
    void remove(K key) {
        slots.remove(key);
    }
    
    void clear() {
        slots.clear();
    }
}
