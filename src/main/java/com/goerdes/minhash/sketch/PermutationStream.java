package com.goerdes.minhash.sketch;

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * Lazily yields exactly {@code permutations} words derived from one 64-bit
 * digest. The digest is scrambled by two SplitMix64 rounds, narrowed to the
 * word width and then walked with {@link WordType#advance(long)}; the value
 * emitted at position {@code i} is the permutation value of slot {@code i}.
 * <p>
 * A stream is single-use. Restarting means creating a new one from the same
 * digest, which yields the same sequence.
 */
public final class PermutationStream implements PrimitiveIterator.OfLong {

    private final WordType wordType;
    private final int permutations;
    private long current;
    private int emitted;

    private PermutationStream(long digest, WordType wordType, int permutations) {
        this.wordType = wordType;
        this.permutations = permutations;
        this.current = wordType.narrow(SplitMix64.mix(SplitMix64.mix(digest)));
    }

    public static PermutationStream of(long digest, WordType wordType, int permutations) {
        if (permutations < 0) {
            throw new IllegalArgumentException("Number of permutations must not be negative: " + permutations);
        }
        return new PermutationStream(digest, wordType, permutations);
    }

    @Override
    public boolean hasNext() {
        return emitted < permutations;
    }

    @Override
    public long nextLong() {
        if (emitted >= permutations) {
            throw new NoSuchElementException("All " + permutations + " permutations consumed");
        }
        emitted++;
        current = wordType.advance(current);
        return current;
    }
}
