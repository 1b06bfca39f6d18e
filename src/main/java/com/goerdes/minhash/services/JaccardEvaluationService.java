package com.goerdes.minhash.services;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.goerdes.minhash.components.SketchProvider;
import com.goerdes.minhash.exception.SketchProcessingException;
import com.goerdes.minhash.model.EvaluationRecord;
import com.goerdes.minhash.sketch.MinHashSketch;
import com.goerdes.minhash.sketch.WordType;
import com.goerdes.minhash.utils.SetUtils;
import com.google.common.hash.Funnels;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Measures how well sketches of several shapes estimate the Jaccard index of
 * pseudo-random sets, and how long building them takes.
 */
@Service
@RequiredArgsConstructor
public class JaccardEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(JaccardEvaluationService.class);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();

    private static final long FIRST_SET_SEED = 4567L;
    private static final long SECOND_SET_SEED = 47325567L;

    private final SketchProvider sketchProvider;

    /**
     * Runs one evaluation iteration. For every element count two sets are
     * drawn, and for every word type and permutation count both sets are
     * sketched and compared.
     *
     * @param iteration     iteration number, varies the drawn sets
     * @param elementCounts number of draws per set
     * @param wordTypes     slot widths to evaluate
     * @param permutations  numbers of permutations to evaluate
     * @return one record per (element count, word type, permutations)
     * @throws IllegalArgumentException if an element count or a number of permutations is negative
     */
    public List<EvaluationRecord> evaluate(int iteration, List<Integer> elementCounts,
                                           List<WordType> wordTypes, List<Integer> permutations) {
        for (int elements : elementCounts) {
            if (elements < 0) {
                throw new IllegalArgumentException("Number of elements must not be negative: " + elements);
            }
        }
        for (int p : permutations) {
            if (p < 0) {
                throw new IllegalArgumentException("Number of permutations must not be negative: " + p);
            }
        }
        List<EvaluationRecord> records = new ArrayList<>();
        for (int elements : elementCounts) {
            Set<Long> first = SetUtils.populateSet(elements, seed(FIRST_SET_SEED, elements, iteration));
            Set<Long> second = SetUtils.populateSet(elements, seed(SECOND_SET_SEED, elements, iteration));
            double groundTruth = SetUtils.jaccard(first, second);
            log.info("Evaluating {} elements (iteration {}), exact Jaccard {}", elements, iteration, groundTruth);

            for (WordType wordType : wordTypes) {
                for (int p : permutations) {
                    records.add(evaluate(elements, wordType, p, first, second, groundTruth));
                }
            }
        }
        return records;
    }

    private EvaluationRecord evaluate(int elements, WordType wordType, int permutations,
                                      Set<Long> first, Set<Long> second, double groundTruth) {
        long start = System.nanoTime();
        MinHashSketch a = MinHashSketch.fromIterable(wordType, permutations, first, Funnels.longFunnel(), sketchProvider.getHashFamily());
        MinHashSketch b = MinHashSketch.fromIterable(wordType, permutations, second, Funnels.longFunnel(), sketchProvider.getHashFamily());
        double approximation = a.estimateJaccardIndex(b);
        long micros = (System.nanoTime() - start) / 1_000;

        return new EvaluationRecord(elements, permutations, wordType, a.memory(), approximation, groundTruth, micros);
    }

    /**
     * Writes the records as CSV with a header line, creating parent directories as needed.
     *
     * @param records the rows to write
     * @param target  the CSV file
     * @throws SketchProcessingException if the file cannot be written
     */
    public void writeCsv(List<EvaluationRecord> records, Path target) {
        CsvSchema schema = CSV_MAPPER.schemaFor(EvaluationRecord.class).withHeader();
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            try (SequenceWriter writer = CSV_MAPPER.writer(schema).writeValues(target.toFile())) {
                writer.writeAll(records);
            }
        } catch (IOException e) {
            throw new SketchProcessingException("Failed to write evaluation report " + target, e);
        }
        log.info("Wrote {} evaluation records to {}", records.size(), target.toAbsolutePath());
    }

    /**
     * Reads back a report written by {@link #writeCsv(List, Path)}.
     *
     * @throws SketchProcessingException if the file cannot be read
     */
    public List<EvaluationRecord> readCsv(Path source) {
        CsvSchema schema = CSV_MAPPER.schemaFor(EvaluationRecord.class).withHeader();
        try {
            return CSV_MAPPER.readerFor(EvaluationRecord.class).with(schema)
                    .<EvaluationRecord>readValues(source.toFile())
                    .readAll();
        } catch (IOException e) {
            throw new SketchProcessingException("Failed to read evaluation report " + source, e);
        }
    }

    private static long seed(long base, int elements, int iteration) {
        return base * (elements + 1L) * (iteration + 1L);
    }

}
