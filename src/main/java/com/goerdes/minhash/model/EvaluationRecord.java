package com.goerdes.minhash.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.goerdes.minhash.sketch.WordType;

/**
 * One row of a Jaccard evaluation run: the sketch parametrization, its memory
 * in bits, the estimate, the exact value and the time (µs) spent building both
 * sketches and estimating.
 */
@JsonPropertyOrder({"elements", "permutations", "word", "memory", "approximation", "ground_truth", "time"})
public record EvaluationRecord(
        int elements,
        int permutations,
        WordType word,
        long memory,
        double approximation,
        @JsonProperty("ground_truth") double groundTruth,
        long time
) {

    public double absoluteError() {
        return Math.abs(approximation - groundTruth);
    }
}
