package com.pavan.leastrecent.cache;

import java.util.Objects;

/**
 * Entry pushed out by {@link LRUCache#setWithOutcome(Object, Object)}: either the previous
 * value of the key that was written, or a different entry evicted to make room.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public final class Displaced<K, V> {
    
    public enum Kind {
        /** The written key already existed; its old value was replaced. */
        OVERWRITTEN,
        /** A different, least recently used key was removed. */
        EVICTED
    }
    
    private final Kind kind;
    private final K key;
    private final V value;
    
    private Displaced(Kind kind, K key, V value) {
        this.kind = kind;
        this.key = key;
        this.value = value;
    }
    
    public static <K, V> Displaced<K, V> overwritten(K key, V previousValue) {
        return new Displaced<>(Kind.OVERWRITTEN, key, previousValue);
    }
    
    public static <K, V> Displaced<K, V> evicted(K key, V value) {
        return new Displaced<>(Kind.EVICTED, key, value);
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public boolean isEvicted() {
        return kind == Kind.EVICTED;
    }
    
    public K getKey() {
        return key;
    }
    
    public V getValue() {
        return value;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Displaced)) {
            return false;
        }
        Displaced<?, ?> other = (Displaced<?, ?>) o;
        return kind == other.kind && Objects.equals(key, other.key) && Objects.equals(value, other.value);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, key, value);
    }
    
    @Override
    public String toString() {
        return "Displaced{" + kind.name().toLowerCase() + ", key=" + key + ", value=" + value + "}";
    }
}
