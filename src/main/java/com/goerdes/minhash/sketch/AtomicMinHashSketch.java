package com.goerdes.minhash.sketch;

import com.goerdes.minhash.hashing.HashFamily;
import com.google.common.hash.Funnel;

import java.util.Arrays;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLongArray;

/**
 * MinHash sketch whose slots can be lowered by any number of threads at once
 * without locking. Each slot is an independent atomic word updated with a
 * fetch-min; since min is commutative, associative and idempotent, any
 * interleaving of {@code fetchInsert} calls ends in the same state as some
 * sequential order of the same insertions.
 * <p>
 * No ordering between different slots is provided. Comparisons and merges
 * should be done on a {@link #snapshot()} taken once writers are done.
 */
public final class AtomicMinHashSketch {

    private final WordType wordType;
    private final AtomicLongArray slots;

    /**
     * Creates an empty sketch with every slot set to the MAX sentinel.
     *
     * @param wordType     slot width
     * @param permutations number of slots, may be zero
     * @throws IllegalArgumentException if {@code permutations} is negative
     */
    public AtomicMinHashSketch(WordType wordType, int permutations) {
        if (permutations < 0) {
            throw new IllegalArgumentException("Number of permutations must not be negative: " + permutations);
        }
        this.wordType = Objects.requireNonNull(wordType, "wordType");
        long[] words = new long[permutations];
        Arrays.fill(words, wordType.max());
        this.slots = new AtomicLongArray(words);
    }

    private AtomicMinHashSketch(WordType wordType, long[] words) {
        this.wordType = wordType;
        this.slots = new AtomicLongArray(words);
    }

    /**
     * Creates an atomic sketch starting from the slots of {@code sketch}.
     * Later updates to either sketch do not affect the other.
     */
    public static AtomicMinHashSketch from(MinHashSketch sketch) {
        return new AtomicMinHashSketch(sketch.getWordType(), sketch.words());
    }

    /**
     * Inserts {@code value} by lowering every slot with {@link #fetchMin(int, long, MemoryOrdering)}.
     * Safe to call from any number of threads.
     *
     * @param value    the element to insert
     * @param funnel   feeds the element into the hasher
     * @param family   hash family, must match the one used for queries
     * @param ordering memory ordering of each slot update
     */
    public <T> void fetchInsert(T value, Funnel<? super T> funnel, HashFamily family, MemoryOrdering ordering) {
        fetchInsertDigest(family.hash(value, funnel), ordering);
    }

    /**
     * Same as {@link #fetchInsert(Object, Funnel, HashFamily, MemoryOrdering)}
     * for a primitive value, hashed as eight little-endian bytes.
     */
    public void fetchInsert(long value, HashFamily family, MemoryOrdering ordering) {
        fetchInsertDigest(family.hashLong(value), ordering);
    }

    private void fetchInsertDigest(long digest, MemoryOrdering ordering) {
        PermutationStream permutations = PermutationStream.of(digest, wordType, slots.length());
        for (int i = 0; i < slots.length(); i++) {
            fetchMin(i, permutations.nextLong(), ordering);
        }
    }

    /**
     * Atomically replaces slot {@code index} with the minimum of its current
     * value and {@code value}.
     *
     * @param index    slot to update
     * @param value    candidate, narrowed to the word type first
     * @param ordering memory ordering of the load and the compare-and-set
     * @return the slot value before the update
     */
    public long fetchMin(int index, long value, MemoryOrdering ordering) {
        long candidate = wordType.narrow(value);
        long current = ordering.load(slots, index);
        while (!wordType.isLessOrEqual(current, candidate)) {
            if (ordering.weakCompareAndSet(slots, index, current, candidate)) {
                return current;
            }
            current = ordering.load(slots, index);
        }
        return current;
    }

    /**
     * One-sided membership test against the current slot values: never false
     * for a value whose insertion has completed, but may be true for values
     * never inserted.
     */
    public <T> boolean mayContain(T value, Funnel<? super T> funnel, HashFamily family) {
        return mayContainDigest(family.hash(value, funnel));
    }

    public boolean mayContain(long value, HashFamily family) {
        return mayContainDigest(family.hashLong(value));
    }

    private boolean mayContainDigest(long digest) {
        PermutationStream permutations = PermutationStream.of(digest, wordType, slots.length());
        for (int i = 0; i < slots.length(); i++) {
            if (!wordType.isLessOrEqual(slots.get(i), permutations.nextLong())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return whether no slot was lowered yet; vacuously true without slots
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
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) != expected) {
                return false;
            }
        }
        return true;
    }

    /**
     * Estimates the Jaccard index against another atomic sketch from the
     * current slot values. Only meaningful when neither sketch is being written.
     */
    public double estimateJaccardIndex(AtomicMinHashSketch other) {
        return snapshot().estimateJaccardIndex(other.snapshot());
    }

    /**
     * Copies the current slot values into a plain sketch. Each slot is read
     * atomically; the copy as a whole is not.
     */
    public MinHashSketch snapshot() {
        long[] words = new long[slots.length()];
        for (int i = 0; i < words.length; i++) {
            words[i] = slots.get(i);
        }
        return MinHashSketch.wrap(wordType, words);
    }

    /**
     * @return memory used by the slots, in bits
     */
    public long memory() {
        return (long) slots.length() * wordType.bits();
    }

    public int getNumberOfPermutations() {
        return slots.length();
    }

    public WordType getWordType() {
        return wordType;
    }

    /**
     * Raw slot value read with volatile semantics, for inspection only.
     */
    public long get(int index) {
        return slots.get(index);
    }

    @Override
    public String toString() {
        return "AtomicMinHashSketch{" + wordType + " x " + slots.length() + "}";
    }
}
