package dev.traininglog.core.backend;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ValueNormalizerTest {

    @Test
    void scalarsPassThrough() {
        assertEquals(45, ValueNormalizer.normalize(45));
        assertEquals("foo", ValueNormalizer.normalize("foo"));
        assertNull(ValueNormalizer.normalize(null));
    }

    @Test
    void primitiveArraysBecomeLists() {
        assertEquals(List.of(1.0, 2.5), ValueNormalizer.normalize(new double[]{1.0, 2.5}));
        assertEquals(List.of(1, 2, 3), ValueNormalizer.normalize(new int[]{1, 2, 3}));
    }

    @Test
    void multidimensionalArraysBecomeNestedLists() {
        final float[][] matrix = {{1f, 2f}, {3f, 4f}};

        assertEquals(List.of(List.of(1f, 2f), List.of(3f, 4f)), ValueNormalizer.normalize(matrix));
    }

    @Test
    void collectionsAndMapsAreNormalizedRecursively() {
        final Object normalized = ValueNormalizer.normalize(Map.of("weights", Set.of(new long[]{7L})));

        assertEquals(Map.of("weights", List.of(List.of(7L))), normalized);
    }
}
