package com.goerdes.minhash.sketch;

import java.util.Arrays;
import java.util.Iterator;

/**
 * A fixed number of independent sketches of the same shape, e.g. one per
 * bucket. Operations on one entry never affect another.
 */
public final class SketchBatch implements Iterable<MinHashSketch> {

    private final MinHashSketch[] sketches;

    public SketchBatch(WordType wordType, int permutations, int size) {
        if (size < 0) {
            throw new IllegalArgumentException("Batch size must not be negative: " + size);
        }
        this.sketches = new MinHashSketch[size];
        for (int i = 0; i < size; i++) {
            sketches[i] = new MinHashSketch(wordType, permutations);
        }
    }

    public MinHashSketch get(int index) {
        return sketches[index];
    }

    public int size() {
        return sketches.length;
    }

    /**
     * @return total bits used by all sketches of the batch
     */
    public long memory() {
        return Arrays.stream(sketches).mapToLong(MinHashSketch::memory).sum();
    }

    @Override
    public Iterator<MinHashSketch> iterator() {
        return Arrays.asList(sketches).iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SketchBatch other && Arrays.equals(sketches, other.sketches);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(sketches);
    }
}
