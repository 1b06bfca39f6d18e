package com.goerdes.minhash.utils;

import com.goerdes.minhash.sketch.SplitMix64;
import com.goerdes.minhash.sketch.WordType;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Utility methods for generating sample sets and computing exact set similarity.
 */
public final class SetUtils {

    private SetUtils() {
    }

    /**
     * Draws {@code elements} pseudo-random values in {@code [0, elements)} and
     * returns the distinct ones. The same random state yields the same set.
     *
     * @param elements    number of draws, also the exclusive upper bound of the values
     * @param randomState seed of the generator
     * @return a set with at most {@code elements} values
     */
    public static Set<Long> populateSet(int elements, long randomState) {
        Set<Long> set = new HashSet<>();
        long state = SplitMix64.mix(randomState);
        for (int i = 0; i < elements; i++) {
            state = WordType.U64.advance(state);
            set.add(Long.remainderUnsigned(state, elements));
        }
        return set;
    }

    /**
     * Computes the Jaccard index |A ∩ B| / |A ∪ B|. Two empty collections are
     * considered identical.
     */
    public static <T> double jaccard(Collection<? extends T> a, Collection<? extends T> b) {
        Set<T> left = new HashSet<>(a);
        Set<T> right = new HashSet<>(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 1.0;
        }
        long intersection = left.stream().filter(right::contains).count();
        long union = left.size() + right.size() - intersection;
        return (double) intersection / union;
    }
}
