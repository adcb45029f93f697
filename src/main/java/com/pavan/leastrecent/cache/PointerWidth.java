package com.pavan.leastrecent.cache;

/**
 * Unsigned integer widths available for slot pointers.
 * The narrowest width able to address {@code capacity - 1} keeps the linkage arrays small.
 */
public enum PointerWidth {
    
    UINT8(8, 0xFFL) {
        @Override
        PointerArray allocate(int length) {
            return new PointerArray.Uint8(length);
        }
    },
    UINT16(16, 0xFFFFL) {
        @Override
        PointerArray allocate(int length) {
            return new PointerArray.Uint16(length);
        }
    },
    UINT32(32, 0xFFFF_FFFFL) {
        @Override
        PointerArray allocate(int length) {
            return new PointerArray.Uint32(length);
        }
    };
    
    private final int bits;
    private final long maxPointer;
    
    PointerWidth(int bits, long maxPointer) {
        this.bits = bits;
        this.maxPointer = maxPointer;
    }
    
    /**
     * Selects the narrowest width able to index {@code capacity} slots.
     *
     * @param capacity number of slots, must be positive
     * @return the pointer width for the slot range {@code [0, capacity)}
     * @throws CapacityUnsupportedException if {@code capacity - 1} exceeds the 32-bit unsigned maximum
     */
    public static PointerWidth forCapacity(long capacity) {
        long maxIndex = capacity - 1;
        for (PointerWidth width : values()) {
            if (maxIndex <= width.maxPointer) {
                return width;
            }
        }
        throw new CapacityUnsupportedException(
            "Pointer array of size > " + UINT32.maxPointer + " is not supported: " + capacity);
    }
    
    public int bits() {
        return bits;
    }
    
    public long maxPointer() {
        return maxPointer;
    }
    
    abstract PointerArray allocate(int length);
}
