package com.pavan.leastrecent.cache;

/**
 * Doubly linked recency chain laid over fixed pointer arrays.
 * <p>
 * {@code forward} points toward the least recently used end, {@code backward} toward the
 * most recently used end. Links of the head's predecessor and the tail's successor are
 * never read. Every operation touches a constant number of cells and allocates nothing.
 */
final class RecencyList {
    
    private final PointerArray forward;
    private final PointerArray backward;
    private int head;
    private int tail;
    private boolean empty;
    
    RecencyList(PointerWidth width, int capacity) {
        this.forward = width.allocate(capacity);
        this.backward = width.allocate(capacity);
        reset();
    }
    
    int head() {
        return head;
    }
    
    int tail() {
        return tail;
    }
    
    boolean isEmpty() {
        return empty;
    }
    
    /**
     * Returns the slot following {@code slot} toward the tail.
     * Undefined when {@code slot} is the tail.
     */
    int next(int slot) {
        return forward.get(slot);
    }
    
    /**
     * Returns the slot preceding {@code slot} toward the head.
     * Undefined when {@code slot} is the head.
     */
    int previous(int slot) {
        return backward.get(slot);
    }
    
    /**
     * Links a slot that is not in the chain in front of the current head.
     */
    void insertFresh(int slot) {
        if (empty) {
            head = slot;
            tail = slot;
            empty = false;
            return;
        }
        forward.set(slot, head);
        backward.set(head, slot);
        head = slot;
    }
    
    /**
     * Relocates a live slot to the head without disturbing the order of the others.
     *
     * @return true if the chain changed, false if the slot already was the head
     */
    boolean moveToFront(int slot) {
        if (slot == head) {
            return false;
        }
        
        int previous = backward.get(slot);
        int next = forward.get(slot);
        
        if (slot == tail) {
            tail = previous;
        } else {
            backward.set(next, previous);
        }
        forward.set(previous, next);
        
        backward.set(head, slot);
        forward.set(slot, head);
        head = slot;
        return true;
    }
    
    /**
     * Unlinks the tail. The caller owns the returned slot and must drop its key from the
     * index before reusing it.
     *
     * @return the slot that was least recently used
     */
    int evictTail() {
        if (empty) {
            throw new IllegalStateException("Cannot evict from an empty recency list");
        }
        int slot = tail;
        if (slot == head) {
            empty = true;
        } else {
            tail = backward.get(slot);
        }
        return slot;
    }
    
    void reset() {
        head = 0;
        tail = 0;
        empty = true;
    }
}
