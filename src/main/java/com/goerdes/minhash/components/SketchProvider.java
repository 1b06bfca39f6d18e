package com.goerdes.minhash.components;

import com.goerdes.minhash.hashing.HashFamily;
import com.goerdes.minhash.hashing.HashFamilyType;
import com.goerdes.minhash.sketch.AtomicMinHashSketch;
import com.goerdes.minhash.sketch.MinHashSketch;
import com.goerdes.minhash.sketch.SketchBatch;
import com.goerdes.minhash.sketch.WordType;
import com.google.common.hash.Funnel;
import com.google.common.hash.Funnels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Creates sketches sharing one configured shape and hash family, so that every
 * sketch handed out by the application can be merged with and compared to
 * every other.
 */
@Component
public class SketchProvider {

    private static final Logger log = LoggerFactory.getLogger(SketchProvider.class);

    /** Tokens are hashed as their UTF-8 bytes. */
    public static final Funnel<CharSequence> TOKEN_FUNNEL = Funnels.stringFunnel(StandardCharsets.UTF_8);

    private final WordType wordType;
    private final int permutations;
    private final HashFamily hashFamily;

    public SketchProvider(@Value("${minhash.word-type:U64}") WordType wordType,
                          @Value("${minhash.permutations:128}") int permutations,
                          @Value("${minhash.hash-family:SIPHASH13}") HashFamilyType hashFamilyType,
                          @Value("${minhash.key0:0}") long key0,
                          @Value("${minhash.key1:0}") long key1) {
        if (permutations < 0) {
            throw new IllegalArgumentException("minhash.permutations must not be negative: " + permutations);
        }
        this.wordType = wordType;
        this.permutations = permutations;
        this.hashFamily = hashFamilyType.create(key0, key1);
        log.info("MinHash sketches: {} permutations of {} ({} bits), hash family {}",
                permutations, wordType, (long) permutations * wordType.bits(), hashFamilyType);
    }

    public MinHashSketch newSketch() {
        return new MinHashSketch(wordType, permutations);
    }

    public AtomicMinHashSketch newAtomicSketch() {
        return new AtomicMinHashSketch(wordType, permutations);
    }

    public SketchBatch newBatch(int size) {
        return new SketchBatch(wordType, permutations, size);
    }

    /**
     * Builds the sketch of a token collection.
     *
     * @param tokens the tokens to insert
     * @return a sketch holding all tokens
     */
    public MinHashSketch sketch(Iterable<? extends CharSequence> tokens) {
        return MinHashSketch.fromIterable(wordType, permutations, tokens, TOKEN_FUNNEL, hashFamily);
    }

    public WordType getWordType() {
        return wordType;
    }

    public int getPermutations() {
        return permutations;
    }

    public HashFamily getHashFamily() {
        return hashFamily;
    }
}
