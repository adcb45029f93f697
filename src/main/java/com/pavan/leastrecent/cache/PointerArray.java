package com.pavan.leastrecent.cache;

/**
 * Fixed-length array of unsigned slot pointers.
 * Implementations store each pointer in the narrowest primitive that fits the cache capacity.
 */
interface PointerArray {
    
    int get(int index);
    
    void set(int index, int pointer);
    
    int length();
    
    final class Uint8 implements PointerArray {
        
        private final byte[] pointers;
        
        Uint8(int length) {
            this.pointers = new byte[length];
        }
        
        @Override
        public int get(int index) {
            return pointers[index] & 0xFF;
        }
        
        @Override
        public void set(int index, int pointer) {
            pointers[index] = (byte) pointer;
        }
        
        @Override
        public int length() {
            return pointers.length;
        }
    }
    
    final class Uint16 implements PointerArray {
        
        private final short[] pointers;
        
        Uint16(int length) {
            this.pointers = new short[length];
        }
        
        @Override
        public int get(int index) {
            return pointers[index] & 0xFFFF;
        }
        
        @Override
        public void set(int index, int pointer) {
            pointers[index] = (short) pointer;
        }
        
        @Override
        public int length() {
            return pointers.length;
        }
    }
    
    // Slots never exceed Integer.MAX_VALUE, so the sign bit is never set.
    final class Uint32 implements PointerArray {
        
        private final int[] pointers;
        
        Uint32(int length) {
            this.pointers = new int[length];
        }
        
        @Override
        public int get(int index) {
            return pointers[index];
        }
        
        @Override
        public void set(int index, int pointer) {
            pointers[index] = pointer;
        }
        
        @Override
        public int length() {
            return pointers.length;
        }
    }
}
