package com.goerdes.minhash.components;

import com.goerdes.minhash.hashing.HashFamily;
import com.goerdes.minhash.hashing.HashFamilyType;
import com.goerdes.minhash.sketch.MinHashSketch;
import com.goerdes.minhash.sketch.WordType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
public class SketchProviderTest {

    @Autowired
    private SketchProvider sketchProvider;

    @Test
    void testConfigurationIsApplied() {
        assertEquals(WordType.U64, sketchProvider.getWordType());
        assertEquals(128, sketchProvider.getPermutations());
        assertEquals(HashFamilyType.KEYED_SIPHASH13, sketchProvider.getHashFamily().type());
        assertEquals(HashFamily.sipHash13(0x0123456789ABCDEFL, 0xFEDCBA9876543210L), sketchProvider.getHashFamily());
    }

    @Test
    void testCreatedSketchesShareShape() {
        MinHashSketch sketch = sketchProvider.newSketch();
        assertTrue(sketch.isEmpty());
        assertEquals(128 * 64, sketch.memory());
        assertEquals(128, sketchProvider.newAtomicSketch().getNumberOfPermutations());
        assertEquals(3, sketchProvider.newBatch(3).size());
    }

    @Test
    void testSketchOfTokens() {
        MinHashSketch sketch = sketchProvider.sketch(List.of("alpha", "beta"));
        assertTrue(sketch.mayContain("alpha", SketchProvider.TOKEN_FUNNEL, sketchProvider.getHashFamily()));
        assertTrue(sketch.mayContain("beta", SketchProvider.TOKEN_FUNNEL, sketchProvider.getHashFamily()));
    }

    @Test
    void testNegativePermutationsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new SketchProvider(WordType.U32, -1, HashFamilyType.FNV, 0L, 0L));
    }
}
