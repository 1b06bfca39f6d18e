package com.goerdes.minhash.api;

import com.goerdes.minhash.exception.SketchProcessingException;
import com.goerdes.minhash.model.ComparisonRequest;
import com.goerdes.minhash.model.EvaluationRecord;
import com.goerdes.minhash.model.SketchComparison;
import com.goerdes.minhash.services.JaccardEvaluationService;
import com.goerdes.minhash.services.SketchComparisonService;
import com.goerdes.minhash.sketch.WordType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class SketchController {

    private final SketchComparisonService comparisonService;
    private final JaccardEvaluationService evaluationService;

    /**
     * Sketches both token lists and returns the estimated and exact Jaccard index.
     *
     * @param request the two token lists
     * @return a ResponseEntity containing the SketchComparison
     */
    @PostMapping("/compare")
    public ResponseEntity<SketchComparison> compare(@RequestBody ComparisonRequest request) {
        if (request.first() == null || request.second() == null) {
            throw new IllegalArgumentException("Both 'first' and 'second' token lists are required");
        }
        if (request.first().contains(null) || request.second().contains(null)) {
            throw new IllegalArgumentException("Token lists must not contain null tokens");
        }
        return ResponseEntity.ok(comparisonService.compare(request.first(), request.second()));
    }

    /**
     * Runs one evaluation iteration and returns the records.
     *
     * @param elements     element counts of the drawn sets
     * @param permutations numbers of permutations to evaluate
     * @param wordTypes    slot widths to evaluate
     * @param iteration    iteration number, varies the drawn sets
     * @return a ResponseEntity containing one record per parametrization
     */
    @GetMapping("/evaluation")
    public ResponseEntity<List<EvaluationRecord>> evaluate(
            @RequestParam(value = "elements", defaultValue = "1000") List<Integer> elements,
            @RequestParam(value = "permutations", defaultValue = "128") List<Integer> permutations,
            @RequestParam(value = "wordTypes", defaultValue = "U64") List<WordType> wordTypes,
            @RequestParam(value = "iteration", defaultValue = "0") int iteration
    ) {
        return ResponseEntity.ok(evaluationService.evaluate(iteration, elements, wordTypes, permutations));
    }

    @ExceptionHandler({SketchProcessingException.class, IllegalArgumentException.class})
    public ResponseEntity<String> onError(RuntimeException ex) {
        return ResponseEntity.badRequest().body(ex.getMessage());
    }

}
