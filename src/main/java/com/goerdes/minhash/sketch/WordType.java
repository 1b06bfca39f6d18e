package com.goerdes.minhash.sketch;

/**
 * Unsigned slot width of a sketch. Each constant knows its sentinels, how a
 * 64-bit digest is narrowed to it and the xorshift step used to walk a
 * permutation stream.
 * <p>
 * Word values are carried in a {@code long} and always lie within
 * {@code [0, max()]}; they must be compared with {@link #min(long, long)} or
 * {@link #isLessOrEqual(long, long)}, never with the signed operators.
 */
public enum WordType {

    U8(Byte.SIZE) {
        @Override
        public long advance(long word) {
            long x = word & 0xFFL;
            x ^= (x << 3) & 0xFFL;
            x ^= x >>> 7;
            x ^= (x << 1) & 0xFFL;
            return x;
        }
    },

    U16(Short.SIZE) {
        @Override
        public long advance(long word) {
            return U32.advance(word & 0xFFFFL) & 0xFFFFL;
        }
    },

    U32(Integer.SIZE) {
        @Override
        public long advance(long word) {
            int x = (int) word;
            x ^= x << 13;
            x ^= x >>> 17;
            x ^= x << 5;
            return Integer.toUnsignedLong(x);
        }
    },

    U64(Long.SIZE) {
        @Override
        public long advance(long word) {
            long x = word;
            x ^= x << 13;
            x ^= x >>> 7;
            x ^= x << 17;
            return x;
        }
    },

    /**
     * Width of the running JVM's data model, 32 or 64 bits.
     */
    PLATFORM(platformBits()) {
        @Override
        public long advance(long word) {
            return narrow(U64.advance(word));
        }
    };

    private final int bits;
    private final long mask;

    WordType(int bits) {
        this.bits = bits;
        this.mask = bits == Long.SIZE ? -1L : (1L << bits) - 1;
    }

    /**
     * Next value of the width-specific xorshift sequence. The step is a
     * bijection on the word domain for U8, U32 and U64 and maps zero to zero.
     *
     * @param word current value, within {@code [0, max()]}
     * @return the following value
     */
    public abstract long advance(long word);

    public int bits() {
        return bits;
    }

    /**
     * @return the all-ones sentinel marking an untouched slot
     */
    public long max() {
        return mask;
    }

    public long zero() {
        return 0L;
    }

    /**
     * Truncates a 64-bit digest (or any narrower unsigned value) to this width.
     * Narrower inputs are already zero-extended in their {@code long} carrier.
     */
    public long narrow(long digest) {
        return digest & mask;
    }

    public long min(long a, long b) {
        return Long.compareUnsigned(a, b) <= 0 ? a : b;
    }

    public boolean isLessOrEqual(long a, long b) {
        return Long.compareUnsigned(a, b) <= 0;
    }

    private static int platformBits() {
        return "32".equals(System.getProperty("sun.arch.data.model")) ? Integer.SIZE : Long.SIZE;
    }
}
