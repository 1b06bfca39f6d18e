package com.goerdes.minhash.sketch;

import com.goerdes.minhash.hashing.HashFamily;
import com.google.common.hash.Funnel;

import java.util.Arrays;
import java.util.Objects;

/**
 * Fixed-size MinHash signature of a set.
 * <p>
 * Slot {@code i} holds the smallest value that any inserted element produced
 * at position {@code i} of its {@link PermutationStream}; untouched slots hold
 * {@link WordType#max()}. Slots only ever decrease. Two sketches built with the
 * same word type, number of permutations and {@link HashFamily} can be merged
 * and compared.
 * <p>
 * Not thread-safe: callers mutating a sketch from several threads must
 * synchronize externally or use {@link AtomicMinHashSketch}.
 */
public final class MinHashSketch {

    private final WordType wordType;
    private final long[] words;

    /**
     * Creates an empty sketch with every slot set to the MAX sentinel.
     *
     * @param wordType     slot width
     * @param permutations number of slots, may be zero
     * @throws IllegalArgumentException if {@code permutations} is negative
     */
    public MinHashSketch(WordType wordType, int permutations) {
        if (permutations < 0) {
            throw new IllegalArgumentException("Number of permutations must not be negative: " + permutations);
        }
        this.wordType = Objects.requireNonNull(wordType, "wordType");
        this.words = new long[permutations];
        Arrays.fill(words, wordType.max());
    }

    private MinHashSketch(WordType wordType, long[] words) {
        this.wordType = wordType;
        this.words = words;
    }

    /**
     * Builds a sketch by inserting every value of {@code values}, which is the
     * same as folding {@link #insert(Object, Funnel, HashFamily)} over them
     * starting from an empty sketch.
     */
    public static <T> MinHashSketch fromIterable(WordType wordType, int permutations, Iterable<? extends T> values,
                                                 Funnel<? super T> funnel, HashFamily family) {
        MinHashSketch sketch = new MinHashSketch(wordType, permutations);
        for (T value : values) {
            sketch.insert(value, funnel, family);
        }
        return sketch;
    }

    public static MinHashSketch fromLongs(WordType wordType, int permutations, long[] values, HashFamily family) {
        MinHashSketch sketch = new MinHashSketch(wordType, permutations);
        for (long value : values) {
            sketch.insert(value, family);
        }
        return sketch;
    }

    /**
     * Merges all given sketches into a new one. The result is the sketch of
     * the union of the underlying sets; an empty input yields an empty sketch.
     */
    public static MinHashSketch mergeAll(WordType wordType, int permutations, Iterable<MinHashSketch> sketches) {
        MinHashSketch result = new MinHashSketch(wordType, permutations);
        for (MinHashSketch sketch : sketches) {
            result.merge(sketch);
        }
        return result;
    }

    /** Takes ownership of {@code words} without copying. */
    static MinHashSketch wrap(WordType wordType, long[] words) {
        return new MinHashSketch(wordType, words);
    }

    public <T> void insert(T value, Funnel<? super T> funnel, HashFamily family) {
        insertDigest(family.hash(value, funnel));
    }

    public void insert(long value, HashFamily family) {
        insertDigest(family.hashLong(value));
    }

    /**
     * One-sided membership test: never false for a value inserted with the
     * same family (unless an unrelated sketch was merged in since), but may be
     * true for values never inserted.
     */
    public <T> boolean mayContain(T value, Funnel<? super T> funnel, HashFamily family) {
        return mayContainDigest(family.hash(value, funnel));
    }

    public boolean mayContain(long value, HashFamily family) {
        return mayContainDigest(family.hashLong(value));
    }

    private void insertDigest(long digest) {
        PermutationStream permutations = PermutationStream.of(digest, wordType, words.length);
        for (int i = 0; i < words.length; i++) {
            words[i] = wordType.min(words[i], permutations.nextLong());
        }
    }

    private boolean mayContainDigest(long digest) {
        PermutationStream permutations = PermutationStream.of(digest, wordType, words.length);
        for (long word : words) {
            if (!wordType.isLessOrEqual(word, permutations.nextLong())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return whether no value was ever inserted; vacuously true without slots
     */
    public boolean isEmpty() {
        return allEqual(wordType.max());
    }

    /**
     * @return whether every slot reached zero; vacuously true without slots
     */
    public boolean isFull() {
        return allEqual(wordType.zero());
    }

    private boolean allEqual(long expected) {
        for (long word : words) {
            if (word != expected) {
                return false;
            }
        }
        return true;
    }

    /**
     * Lowers every slot to the minimum of both sketches. Associative,
     * commutative and idempotent; the result is the sketch of the union of
     * both underlying sets.
     *
     * @return this sketch
     * @throws IllegalArgumentException if the sketches differ in word type or number of permutations
     */
    public MinHashSketch merge(MinHashSketch other) {
        checkCompatible(other);
        for (int i = 0; i < words.length; i++) {
            words[i] = wordType.min(words[i], other.words[i]);
        }
        return this;
    }

    /**
     * Like {@link #merge(MinHashSketch)} but leaves both operands untouched.
     */
    public MinHashSketch merged(MinHashSketch other) {
        return copy().merge(other);
    }

    /**
     * Estimates the Jaccard index of the two underlying sets as the fraction
     * of slots holding the same value. A sketch without slots returns 1.0.
     *
     * @throws IllegalArgumentException if the sketches differ in word type or number of permutations
     */
    public double estimateJaccardIndex(MinHashSketch other) {
        checkCompatible(other);
        return estimateJaccardIndex(words, other.words);
    }

    static double estimateJaccardIndex(long[] left, long[] right) {
        if (left.length == 0) {
            return 1.0;
        }
        int matches = 0;
        for (int i = 0; i < left.length; i++) {
            if (left[i] == right[i]) {
                matches++;
            }
        }
        return (double) matches / left.length;
    }

    private void checkCompatible(MinHashSketch other) {
        if (wordType != other.wordType || words.length != other.words.length) {
            throw new IllegalArgumentException(String.format("Incompatible sketches: %s x %d vs %s x %d",
                    wordType, words.length, other.wordType, other.words.length));
        }
    }

    /**
     * @return memory used by the slots, in bits
     */
    public long memory() {
        return (long) words.length * wordType.bits();
    }

    public int getNumberOfPermutations() {
        return words.length;
    }

    public WordType getWordType() {
        return wordType;
    }

    /**
     * Raw slot value, for inspection only.
     */
    public long get(int index) {
        return words[index];
    }

    public long[] words() {
        return words.clone();
    }

    public MinHashSketch copy() {
        return new MinHashSketch(wordType, words.clone());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MinHashSketch other)) {
            return false;
        }
        return wordType == other.wordType && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        return 31 * wordType.hashCode() + Arrays.hashCode(words);
    }

    @Override
    public String toString() {
        return "MinHashSketch{" + wordType + " x " + words.length + "}";
    }
}
