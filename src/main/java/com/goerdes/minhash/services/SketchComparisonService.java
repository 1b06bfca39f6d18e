package com.goerdes.minhash.services;

import com.goerdes.minhash.components.SketchProvider;
import com.goerdes.minhash.exception.SketchProcessingException;
import com.goerdes.minhash.model.SketchComparison;
import com.goerdes.minhash.sketch.AtomicMinHashSketch;
import com.goerdes.minhash.sketch.MemoryOrdering;
import com.goerdes.minhash.sketch.MinHashSketch;
import com.goerdes.minhash.utils.SetUtils;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;

import static com.goerdes.minhash.components.SketchProvider.TOKEN_FUNNEL;

/**
 * Sketches token collections and compares them.
 */
@Service
@RequiredArgsConstructor
public class SketchComparisonService {

    private static final Logger log = LoggerFactory.getLogger(SketchComparisonService.class);

    private final SketchProvider sketchProvider;

    /**
     * Compares two token collections by their sketches and also reports the
     * exact Jaccard index of the collections.
     *
     * @param first  tokens of the first collection
     * @param second tokens of the second collection
     * @return the comparison result
     */
    public SketchComparison compare(Collection<String> first, Collection<String> second) {
        MinHashSketch a = sketchProvider.sketch(first);
        MinHashSketch b = sketchProvider.sketch(second);

        double estimate = a.estimateJaccardIndex(b);
        double exact = SetUtils.jaccard(first, second);
        log.debug("Compared {} and {} tokens: estimate={}, exact={}", first.size(), second.size(), estimate, exact);

        return new SketchComparison() {{
            setEstimatedJaccard(estimate);
            setExactJaccard(exact);
            setPermutations(a.getNumberOfPermutations());
            setMemory(a.memory());
        }};
    }

    /**
     * Compares two already built sketches.
     *
     * @throws IllegalArgumentException if the sketches differ in shape
     */
    public SketchComparison compare(MinHashSketch a, MinHashSketch b) {
        double estimate = a.estimateJaccardIndex(b);
        return new SketchComparison() {{
            setEstimatedJaccard(estimate);
            setPermutations(a.getNumberOfPermutations());
            setMemory(a.memory());
        }};
    }

    /**
     * Builds the sketch of the union of all given collections by merging
     * their individual sketches.
     */
    public MinHashSketch union(List<? extends Collection<String>> collections) {
        return MinHashSketch.mergeAll(
                sketchProvider.getWordType(),
                sketchProvider.getPermutations(),
                collections.stream().map(sketchProvider::sketch).toList()
        );
    }

    /**
     * Inserts the tokens into one shared atomic sketch from a pool of
     * {@code workers} threads. The result equals {@link SketchProvider#sketch(Iterable)}
     * of the same tokens.
     *
     * @param tokens  tokens to insert
     * @param workers parallelism of the worker pool
     * @return a snapshot of the filled sketch
     */
    public MinHashSketch sketchConcurrently(List<String> tokens, int workers) {
        AtomicMinHashSketch sketch = sketchProvider.newAtomicSketch();
        ForkJoinPool pool = new ForkJoinPool(workers);
        try {
            pool.submit(() -> tokens.parallelStream().forEach(token ->
                    sketch.fetchInsert(token, TOKEN_FUNNEL, sketchProvider.getHashFamily(), MemoryOrdering.RELAXED)
            )).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SketchProcessingException("Interrupted while sketching " + tokens.size() + " tokens", e);
        } catch (ExecutionException e) {
            throw new SketchProcessingException("Concurrent sketching failed", e.getCause());
        } finally {
            pool.shutdown();
        }
        log.debug("Sketched {} tokens with {} workers", tokens.size(), workers);
        return sketch.snapshot();
    }

}
