package com.goerdes.minhash.sketch;

/**
 * The SplitMix64 finalizer, used to spread a hash digest before it seeds a
 * permutation stream.
 */
public final class SplitMix64 {

    private SplitMix64() {
    }

    public static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xbf58476d1ce4e5b9L;
        z = (z ^ (z >>> 27)) * 0x94d049bb133111ebL;
        return z ^ (z >>> 31);
    }
}
