package com.pavan.leastrecent.cache;

import com.pavan.leastrecent.metrics.StatsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Collection;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;

/**
 * Fixed-capacity LRU (Least Recently Used) cache.
 * <p>
 * The recency order is a doubly linked list stored in preallocated pointer arrays indexed
 * by slot, so no storage is allocated after construction and every operation is O(1).
 * Slots are claimed in order {@code 0, 1, 2, ...} until the cache is full; after that every
 * new key reuses the slot of the least recently used entry.
 * <p>
 * {@link #set} and a hit on {@link #get} make a key the most recently used one.
 * {@link #peek} and {@link #has} never change the order.
 * <p>
 * Not thread-safe. Iterators fail fast with {@link ConcurrentModificationException} when
 * the cache is written or reordered after they were created.
 *
 * @param <K> the type of keys
 * @param <V> the type of values
 */
public class LRUCache<K, V> implements Iterable<Map.Entry<K, V>> {
    
    private static final Logger logger = LoggerFactory.getLogger(LRUCache.class);
    
    private final int capacity;
    private final PointerWidth pointerWidth;
    private final RecencyList recency;
    private final Object[] keys;
    private final Object[] values;
    private final KeyIndex<K> index;
    private final EvictionNotifier<K, V> notifier;
    private final StatsCollector stats;
    
    private int size;
    private int modCount;
    
    public LRUCache(int capacity) {
        this(capacity, new StatsCollector());
    }
    
    public LRUCache(int capacity, StatsCollector stats) {
        if (capacity <= 0) {
            throw new InvalidCapacityException("Capacity should be a finite positive integer: " + capacity);
        }
        this.capacity = capacity;
        this.pointerWidth = PointerWidth.forCapacity(capacity);
        this.recency = new RecencyList(pointerWidth, capacity);
        this.keys = new Object[capacity];
        this.values = new Object[capacity];
        this.index = new KeyIndex<>(capacity);
        this.notifier = new EvictionNotifier<>();
        this.stats = Objects.requireNonNull(stats, "stats");
        this.size = 0;
        logger.debug("Created LRU cache with capacity {} using {} slot pointers", capacity, pointerWidth);
    }
    
    /**
     * Creates a cache from a numeric capacity of any type, such as a bound configuration value.
     *
     * @param capacity the number of entries to keep
     * @throws InvalidCapacityException if capacity is null, NaN, infinite, fractional or not positive
     * @throws CapacityUnsupportedException if capacity is larger than the cache can address
     */
    public static <K, V> LRUCache<K, V> withCapacity(Number capacity) {
        return new LRUCache<>(checkCapacity(capacity));
    }
    
    /**
     * Builds a cache holding the entries of a map, sized to the map.
     * Entries are written in iteration order, so the last one becomes the most recently used.
     */
    public static <K, V> LRUCache<K, V> from(Map<? extends K, ? extends V> map) {
        return from(map.entrySet(), map.size());
    }
    
    /**
     * Builds a cache from a sequence of entries. The capacity is the collection size when
     * the sequence is a {@link Collection}; other iterables have no known size and are rejected.
     */
    public static <K, V> LRUCache<K, V> from(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        int knownSize = entries instanceof Collection ? ((Collection<?>) entries).size() : 0;
        return from(entries, knownSize);
    }
    
    /**
     * Builds a cache of the given capacity and writes the entries into it in order.
     * Later duplicates of a key win; when there are more distinct keys than capacity, the
     * earliest ones are evicted.
     */
    public static <K, V> LRUCache<K, V> from(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries,
                                             Number capacity) {
        LRUCache<K, V> cache = withCapacity(capacity);
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            cache.set(entry.getKey(), entry.getValue());
        }
        return cache;
    }
    
    static int checkCapacity(Number capacity) {
        if (capacity == null) {
            throw new InvalidCapacityException("Capacity should be a finite positive integer: null");
        }
        long whole;
        if (capacity instanceof Integer || capacity instanceof Long || capacity instanceof Short
                || capacity instanceof Byte || capacity instanceof AtomicInteger || capacity instanceof AtomicLong) {
            whole = capacity.longValue();
        } else if (capacity instanceof BigDecimal) {
            BigDecimal exact = ((BigDecimal) capacity).stripTrailingZeros();
            if (exact.scale() > 0) {
                throw new InvalidCapacityException("Capacity should be a finite positive integer: " + capacity);
            }
            whole = wholeCapacity(exact.toBigIntegerExact(), capacity);
        } else if (capacity instanceof BigInteger) {
            whole = wholeCapacity((BigInteger) capacity, capacity);
        } else {
            double requested = capacity.doubleValue();
            if (Double.isNaN(requested) || Double.isInfinite(requested) || Math.rint(requested) != requested) {
                throw new InvalidCapacityException("Capacity should be a finite positive integer: " + capacity);
            }
            whole = (long) requested;
        }
        if (whole <= 0) {
            throw new InvalidCapacityException("Capacity should be a finite positive integer: " + capacity);
        }
        PointerWidth.forCapacity(whole);
        if (whole > Integer.MAX_VALUE) {
            throw new CapacityUnsupportedException(
                "Capacity exceeds the maximum array length " + Integer.MAX_VALUE + ": " + capacity);
        }
        return (int) whole;
    }
    
    private static long wholeCapacity(BigInteger value, Number requested) {
        if (value.signum() <= 0) {
            throw new InvalidCapacityException("Capacity should be a finite positive integer: " + requested);
        }
        if (value.bitLength() > 63) {
            throw new CapacityUnsupportedException(
                "Pointer array of size > " + PointerWidth.UINT32.maxPointer() + " is not supported: " + requested);
        }
        return value.longValue();
    }
    
    /**
     * Registers a listener for entries evicted to make room for new keys.
     * Listeners are called in registration order.
     *
     * @return a handle that removes this registration
     */
    public Subscription onEvicted(EvictionListener<? super K, ? super V> listener) {
        return notifier.subscribe(listener);
    }
    
    public int capacity() {
        return capacity;
    }
    
    public int size() {
        return size;
    }
    
    public boolean isEmpty() {
        return size == 0;
    }
    
    public PointerWidth pointerWidth() {
        return pointerWidth;
    }
    
    public StatsCollector stats() {
        return stats;
    }
    
    /**
     * Inserts or updates a key-value pair and makes it the most recently used entry.
     * When the key is new and the cache is full, the least recently used entry is evicted
     * and eviction listeners are notified after the new entry is stored.
     *
     * @param key the key to insert or update
     * @param value the value to associate with the key
     */
    public void set(K key, V value) {
        write(key, value, false);
    }
    
    /**
     * Same as {@link #set} but reports what the write displaced.
     *
     * @return {@code null} if the key was new and a free slot was used; an
     *         {@link Displaced.Kind#OVERWRITTEN} result holding the key's previous value; or an
     *         {@link Displaced.Kind#EVICTED} result holding the entry that was evicted
     */
    public Displaced<K, V> setWithOutcome(K key, V value) {
        return write(key, value, true);
    }
    
    /**
     * Retrieves a value by key and makes the key the most recently used one.
     *
     * @param key the key to look up
     * @return the value associated with the key, or null if not found
     */
    public V get(K key) {
        int slot = index.lookup(key);
        if (slot == KeyIndex.ABSENT) {
            stats.recordGet(false);
            return null;
        }
        if (recency.moveToFront(slot)) {
            modCount++;
        }
        stats.recordGet(true);
        return valueAt(slot);
    }
    
    /**
     * Retrieves a value by key without touching the recency order.
     *
     * @param key the key to look up
     * @return the value associated with the key, or null if not found
     */
    public V peek(K key) {
        int slot = index.lookup(key);
        return slot == KeyIndex.ABSENT ? null : valueAt(slot);
    }
    
    public boolean has(K key) {
        return index.contains(key);
    }
    
    /**
     * Removes all entries. Capacity and registered listeners are kept; no listener is notified.
     */
    public void clear() {
        // Live slots are always the prefix [0, size)
        Arrays.fill(keys, 0, size, null);
        Arrays.fill(values, 0, size, null);
        size = 0;
        recency.reset();
        index.clear();
        modCount++;
        stats.recordClear();
    }
    
    /**
     * Iterates keys from most to least recently used.
     */
    public Iterator<K> keys() {
        return new ChainIterator<K>() {
            @Override
            K at(int slot) {
                return keyAt(slot);
            }
        };
    }
    
    /**
     * Iterates values from most to least recently used.
     */
    public Iterator<V> values() {
        return new ChainIterator<V>() {
            @Override
            V at(int slot) {
                return valueAt(slot);
            }
        };
    }
    
    /**
     * Iterates entries from most to least recently used.
     */
    public Iterator<Map.Entry<K, V>> entries() {
        return new ChainIterator<Map.Entry<K, V>>() {
            @Override
            Map.Entry<K, V> at(int slot) {
                return new AbstractMap.SimpleImmutableEntry<>(keyAt(slot), valueAt(slot));
            }
        };
    }
    
    @Override
    public Iterator<Map.Entry<K, V>> iterator() {
        return entries();
    }
    
    /**
     * Visits entries from most to least recently used.
     */
    public void forEach(BiConsumer<? super K, ? super V> action) {
        int expectedModCount = modCount;
        int slot = recency.head();
        for (int i = 0; i < size; i++) {
            action.accept(keyAt(slot), valueAt(slot));
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (i + 1 < size) {
                slot = recency.next(slot);
            }
        }
    }
    
    /**
     * Copies the entries into a map whose iteration order is most to least recently used.
     */
    public Map<K, V> asMap() {
        Map<K, V> copy = new LinkedHashMap<>();
        forEach(copy::put);
        return copy;
    }
    
    @Override
    public String toString() {
        return "LRUCache{capacity=" + capacity + ", size=" + size + ", entries=" + asMap() + "}";
    }
    
    private Displaced<K, V> write(K key, V value, boolean reportDisplaced) {
        stats.recordSet();
        modCount++;
        
        int slot = index.lookup(key);
        
        // Existing key: replace the value in place and splay on top
        if (slot != KeyIndex.ABSENT) {
            V previous = valueAt(slot);
            recency.moveToFront(slot);
            values[slot] = value;
            stats.recordOverwrite();
            return reportDisplaced ? Displaced.overwritten(key, previous) : null;
        }
        
        // Free slots remain
        if (size < capacity) {
            slot = size++;
            store(slot, key, value);
            return null;
        }
        
        // Full: recycle the least recently used slot
        slot = recency.evictTail();
        K evictedKey = keyAt(slot);
        V evictedValue = valueAt(slot);
        index.remove(evictedKey);
        store(slot, key, value);
        stats.recordEviction();
        
        notifier.notifyEvicted(evictedKey, evictedValue);
        return reportDisplaced ? Displaced.evicted(evictedKey, evictedValue) : null;
    }
    
    private void store(int slot, K key, V value) {
        keys[slot] = key;
        values[slot] = value;
        index.insert(key, slot);
        recency.insertFresh(slot);
    }
    
    @SuppressWarnings("unchecked")
    private K keyAt(int slot) {
        return (K) keys[slot];
    }
    
    @SuppressWarnings("unchecked")
    private V valueAt(int slot) {
        return (V) values[slot];
    }
    
    /**
     * Walks the chain from the head for the number of entries live at creation.
     * Single pass; ask the cache for a new iterator to start over.
     */
    private abstract class ChainIterator<T> implements Iterator<T> {
        
        private final int length = size;
        private final int expectedModCount = modCount;
        private int visited;
        private int cursor = recency.head();
        
        @Override
        public boolean hasNext() {
            return visited < length;
        }
        
        @Override
        public T next() {
            if (modCount != expectedModCount) {
                throw new ConcurrentModificationException();
            }
            if (visited >= length) {
                throw new NoSuchElementException();
            }
            int slot = cursor;
            visited++;
            if (visited < length) {
                cursor = recency.next(slot);
            }
            return at(slot);
        }
        
        abstract T at(int slot);
    }
}
