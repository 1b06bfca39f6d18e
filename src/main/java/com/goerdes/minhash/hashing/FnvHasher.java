package com.goerdes.minhash.hashing;

/**
 * 64-bit Fowler–Noll–Vo hasher (xor, then multiply). A keyed hasher starts
 * from the key instead of the offset basis.
 */
final class FnvHasher extends StreamingHasher {

    static final long OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long PRIME = 0x100000001b3L;

    private long state;

    FnvHasher(long initialState) {
        this.state = initialState;
    }

    @Override
    protected void update(byte b) {
        state ^= b & 0xFFL;
        state *= PRIME;
    }

    @Override
    public long finish() {
        return state;
    }
}
