package com.goerdes.minhash.hashing;

/**
 * SipHash with 64-bit output and configurable compression/finalization
 * rounds. Sketches use the 1-3 variant.
 */
final class SipHasher extends StreamingHasher {

    private final int compressionRounds;
    private final int finalizationRounds;

    private long v0;
    private long v1;
    private long v2;
    private long v3;

    /** Pending message bytes, little-endian, not yet compressed. */
    private long block;
    private int blockBytes;
    private long length;

    SipHasher(long key0, long key1, int compressionRounds, int finalizationRounds) {
        this.compressionRounds = compressionRounds;
        this.finalizationRounds = finalizationRounds;
        this.v0 = 0x736f6d6570736575L ^ key0;
        this.v1 = 0x646f72616e646f6dL ^ key1;
        this.v2 = 0x6c7967656e657261L ^ key0;
        this.v3 = 0x7465646279746573L ^ key1;
    }

    static SipHasher sip13(long key0, long key1) {
        return new SipHasher(key0, key1, 1, 3);
    }

    @Override
    protected void update(byte b) {
        block |= (b & 0xFFL) << (Byte.SIZE * blockBytes);
        length++;
        if (++blockBytes == Long.BYTES) {
            compress(block);
            block = 0L;
            blockBytes = 0;
        }
    }

    @Override
    public long finish() {
        compress(block | (length << 56));
        v2 ^= 0xFFL;
        for (int i = 0; i < finalizationRounds; i++) {
            sipRound();
        }
        return v0 ^ v1 ^ v2 ^ v3;
    }

    private void compress(long m) {
        v3 ^= m;
        for (int i = 0; i < compressionRounds; i++) {
            sipRound();
        }
        v0 ^= m;
    }

    private void sipRound() {
        v0 += v1;
        v2 += v3;
        v1 = Long.rotateLeft(v1, 13);
        v3 = Long.rotateLeft(v3, 16);
        v1 ^= v0;
        v3 ^= v2;
        v0 = Long.rotateLeft(v0, 32);
        v2 += v1;
        v0 += v3;
        v1 = Long.rotateLeft(v1, 17);
        v3 = Long.rotateLeft(v3, 21);
        v1 ^= v2;
        v3 ^= v0;
        v2 = Long.rotateLeft(v2, 32);
    }
}
