package com.goerdes.minhash.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Getter;
import lombok.Setter;

/**
 * Result of comparing two token collections through their sketches: the
 * estimated Jaccard index (0.0–1.0), a rating derived from it and, when the
 * collections themselves were available, the exact Jaccard index.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SketchComparison {

    public static final String HIGH = "high";
    public static final String MEDIUM = "medium";
    public static final String LOW = "low";

    /** Minimum estimate (inclusive) to qualify as a “high” similarity. */
    private static final double HIGH_THRESHOLD = 0.8;

    /** Maximum estimate (inclusive) to qualify as a “low” similarity. */
    private static final double LOW_THRESHOLD = 0.3;

    /** Estimated Jaccard index of the two sketches. */
    private double estimatedJaccard;

    /** Category corresponding to the estimate: HIGH, MEDIUM or LOW. */
    private String similarityRating;

    /** Exact Jaccard index, if computed. */
    @Setter
    private Double exactJaccard;

    /** Number of permutations of the compared sketches. */
    @Setter
    private int permutations;

    /** Memory of one sketch, in bits. */
    @Setter
    private long memory;

    /**
     * Updates the estimate and recomputes the rating.
     *
     * @param estimatedJaccard value between 0.0 and 1.0
     */
    public void setEstimatedJaccard(double estimatedJaccard) {
        this.estimatedJaccard = estimatedJaccard;
        this.similarityRating = estimatedJaccard >= HIGH_THRESHOLD ? HIGH : estimatedJaccard <= LOW_THRESHOLD ? LOW : MEDIUM;
    }

    /**
     * @return absolute difference between estimate and exact value, or {@code null} without exact value
     */
    public Double getAbsoluteError() {
        return exactJaccard == null ? null : Math.abs(estimatedJaccard - exactJaccard);
    }

}
