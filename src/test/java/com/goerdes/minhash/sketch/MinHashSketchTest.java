package com.goerdes.minhash.sketch;

import com.goerdes.minhash.hashing.HashFamily;
import com.google.common.hash.Funnels;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;

class MinHashSketchTest {

    private static final HashFamily SIP = HashFamily.sipHash13();

    private static long[] randomLongs(int count, long seed) {
        Random random = new Random(seed);
        Set<Long> values = new LinkedHashSet<>();
        while (values.size() < count) {
            values.add(random.nextLong());
        }
        return values.stream().mapToLong(Long::longValue).toArray();
    }

    @Test
    void testNewSketchIsEmptyAndNotFull() {
        MinHashSketch sketch = new MinHashSketch(WordType.U64, 128);
        assertTrue(sketch.isEmpty());
        assertFalse(sketch.isFull());
        for (int i = 0; i < 128; i++) {
            assertEquals(WordType.U64.max(), sketch.get(i));
        }
        assertFalse(sketch.mayContain(42L, SIP));
    }

    @Test
    void testInsertIsMonotone() {
        MinHashSketch sketch = new MinHashSketch(WordType.U32, 64);
        for (long value : randomLongs(500, 1L)) {
            long[] before = sketch.words();
            sketch.insert(value, SIP);
            long[] after = sketch.words();
            for (int i = 0; i < before.length; i++) {
                assertTrue(WordType.U32.isLessOrEqual(after[i], before[i]), "slot " + i + " grew");
            }
        }
        assertFalse(sketch.isEmpty());
    }

    @Test
    void testInsertIsIdempotent() {
        MinHashSketch once = new MinHashSketch(WordType.U16, 128);
        MinHashSketch twice = new MinHashSketch(WordType.U16, 128);
        once.insert("token", Funnels.stringFunnel(StandardCharsets.UTF_8), SIP);
        twice.insert("token", Funnels.stringFunnel(StandardCharsets.UTF_8), SIP);
        twice.insert("token", Funnels.stringFunnel(StandardCharsets.UTF_8), SIP);
        assertEquals(once, twice);
    }

    @Test
    void testInsertOrderDoesNotMatter() {
        long[] values = randomLongs(1_000, 2L);
        List<Long> shuffled = new ArrayList<>(LongStream.of(values).boxed().toList());
        Collections.shuffle(shuffled, new Random(3L));

        MinHashSketch inOrder = MinHashSketch.fromLongs(WordType.U64, 128, values, SIP);
        MinHashSketch reordered = MinHashSketch.fromIterable(WordType.U64, 128, shuffled, Funnels.longFunnel(), SIP);
        assertEquals(inOrder, reordered);
    }

    @Test
    void testLongOverloadMatchesLongFunnel() {
        MinHashSketch viaLong = new MinHashSketch(WordType.U64, 32);
        MinHashSketch viaFunnel = new MinHashSketch(WordType.U64, 32);
        viaLong.insert(123L, SIP);
        viaFunnel.insert(123L, Funnels.longFunnel(), SIP);
        assertEquals(viaLong, viaFunnel);
    }

    @Test
    void testNoFalseNegatives() {
        for (HashFamily family : List.of(HashFamily.sipHash13(), HashFamily.sipHash13(0x0123456789ABCDEFL, 0xFEDCBA9876543210L),
                HashFamily.fnv(), HashFamily.fnv(0x0123456789ABCDEFL))) {
            for (WordType type : WordType.values()) {
                long[] values = randomLongs(1_000, 4L);
                MinHashSketch sketch = MinHashSketch.fromLongs(type, 128, values, family);
                for (long value : values) {
                    assertTrue(sketch.mayContain(value, family), family + " " + type);
                }
            }
        }
    }

    @Test
    void testFalsePositivesAreRare() {
        MinHashSketch sketch = MinHashSketch.fromLongs(WordType.U64, 128, randomLongs(10, 5L), SIP);
        long positives = LongStream.of(randomLongs(1_000, 6L)).filter(v -> sketch.mayContain(v, SIP)).count();
        assertTrue(positives < 10, "false positives: " + positives);
    }

    @Test
    void testMergeLaws() {
        MinHashSketch a = MinHashSketch.fromLongs(WordType.U32, 128, randomLongs(300, 7L), SIP);
        MinHashSketch b = MinHashSketch.fromLongs(WordType.U32, 128, randomLongs(300, 8L), SIP);
        MinHashSketch c = MinHashSketch.fromLongs(WordType.U32, 128, randomLongs(300, 9L), SIP);

        assertEquals(a.merged(b).merge(c), a.merged(b.merged(c)), "associative");
        assertEquals(a.merged(b), b.merged(a), "commutative");
        assertEquals(a.merged(b), a.merged(b).merge(b), "idempotent");
        assertEquals(a, new MinHashSketch(WordType.U32, 128).merge(a), "empty sketch is the identity");
        assertEquals(a, a.merged(a));
    }

    @Test
    void testMergeIsSketchOfUnion() {
        long[] first = randomLongs(500, 10L);
        long[] second = randomLongs(500, 11L);
        long[] union = LongStream.concat(LongStream.of(first), LongStream.of(second)).toArray();

        MinHashSketch merged = MinHashSketch.fromLongs(WordType.U64, 128, first, SIP)
                .merge(MinHashSketch.fromLongs(WordType.U64, 128, second, SIP));
        assertEquals(MinHashSketch.fromLongs(WordType.U64, 128, union, SIP), merged);
    }

    @Test
    void testMergeAll() {
        List<MinHashSketch> parts = List.of(
                MinHashSketch.fromLongs(WordType.U8, 16, randomLongs(50, 12L), SIP),
                MinHashSketch.fromLongs(WordType.U8, 16, randomLongs(50, 13L), SIP));
        assertEquals(parts.get(0).merged(parts.get(1)), MinHashSketch.mergeAll(WordType.U8, 16, parts));
        assertTrue(MinHashSketch.mergeAll(WordType.U8, 16, List.of()).isEmpty());
    }

    @Test
    void testMergedLeavesOperandsUntouched() {
        MinHashSketch a = MinHashSketch.fromLongs(WordType.U64, 32, new long[]{1L}, SIP);
        MinHashSketch b = MinHashSketch.fromLongs(WordType.U64, 32, new long[]{2L}, SIP);
        MinHashSketch aCopy = a.copy();
        MinHashSketch bCopy = b.copy();
        a.merged(b);
        assertEquals(aCopy, a);
        assertEquals(bCopy, b);
    }

    @Test
    void testIncompatibleSketchesAreRejected() {
        MinHashSketch a = new MinHashSketch(WordType.U64, 128);
        assertThrows(IllegalArgumentException.class, () -> a.merge(new MinHashSketch(WordType.U32, 128)));
        assertThrows(IllegalArgumentException.class, () -> a.estimateJaccardIndex(new MinHashSketch(WordType.U64, 64)));
        assertThrows(IllegalArgumentException.class, () -> new MinHashSketch(WordType.U64, -1));
    }

    @Test
    void testMemory() {
        assertEquals(4096, new MinHashSketch(WordType.U32, 128).memory());
        assertEquals(128 * 64, new MinHashSketch(WordType.U64, 128).memory());
        assertEquals(16 * 8, new MinHashSketch(WordType.U8, 16).memory());
        assertEquals(128, new MinHashSketch(WordType.U64, 128).getNumberOfPermutations());
    }

    @Test
    void testJaccardOfIdenticalAndDisjointSets() {
        long[] values = randomLongs(1_000, 14L);
        MinHashSketch a = MinHashSketch.fromLongs(WordType.U64, 128, values, SIP);
        MinHashSketch b = MinHashSketch.fromLongs(WordType.U64, 128, values, SIP);
        assertEquals(1.0, a.estimateJaccardIndex(b));

        MinHashSketch disjoint = MinHashSketch.fromLongs(WordType.U64, 128, randomLongs(1_000, 15L), SIP);
        assertEquals(0.0, a.estimateJaccardIndex(disjoint));
    }

    @Test
    void testJaccardEstimateWithHalfOverlap() {
        int trials = 20;
        double exact = 5_000.0 / 15_000.0;
        double sum = 0.0;
        int close = 0;
        for (int trial = 0; trial < trials; trial++) {
            double estimate = estimateHalfOverlap(128, 100L + trial);
            assertTrue(Math.abs(estimate - exact) < 0.2, "trial " + trial + " estimated " + estimate);
            if (Math.abs(estimate - exact) < 0.05) {
                close++;
            }
            sum += estimate;
        }
        assertEquals(exact, sum / trials, 0.05);
        assertTrue(close >= trials * 0.6, close + " of " + trials + " estimates within 0.05");
    }

    @Test
    void testWideSketchEstimatesStayWithinTolerance() {
        double exact = 5_000.0 / 15_000.0;
        for (int trial = 0; trial < 10; trial++) {
            double estimate = estimateHalfOverlap(512, 200L + trial);
            assertEquals(exact, estimate, 0.05, "trial " + trial);
        }
    }

    private static double estimateHalfOverlap(int permutations, long seed) {
        long[] pool = randomLongs(15_000, seed);
        long[] first = Arrays.copyOfRange(pool, 0, 10_000);
        long[] second = Arrays.copyOfRange(pool, 5_000, 15_000);
        return MinHashSketch.fromLongs(WordType.U64, permutations, first, SIP)
                .estimateJaccardIndex(MinHashSketch.fromLongs(WordType.U64, permutations, second, SIP));
    }

    @Test
    void testNotFullUnderRandomInsertion() {
        MinHashSketch sketch = MinHashSketch.fromLongs(WordType.U64, 128, randomLongs(10_000, 16L), SIP);
        assertFalse(sketch.isFull());
        assertFalse(sketch.isEmpty());
    }

    @Test
    void testZeroPermutations() {
        MinHashSketch a = new MinHashSketch(WordType.U64, 0);
        MinHashSketch b = new MinHashSketch(WordType.U64, 0);
        a.insert(1L, SIP);
        assertTrue(a.isEmpty());
        assertTrue(a.isFull());
        assertTrue(a.mayContain(2L, SIP));
        assertEquals(0, a.memory());
        assertEquals(1.0, a.estimateJaccardIndex(b));
    }

    @Test
    void testWordsReturnsCopy() {
        MinHashSketch sketch = MinHashSketch.fromLongs(WordType.U64, 8, new long[]{1L}, SIP);
        long[] words = sketch.words();
        words[0] = 0L;
        assertNotEquals(0L, sketch.get(0));
        assertEquals(sketch.words()[3], sketch.get(3));
    }
}
