package br.edu.ifba.graphmemory.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class EmbeddingUtilTest {

    @Test
    @DisplayName("base64 storage keeps every float bit for bit")
    void testBase64() {
        float[] embedding = {0.25f, -1.5f, Float.MIN_VALUE, 3.0e7f};

        assertArrayEquals(embedding, EmbeddingUtil.fromBase64(EmbeddingUtil.toBase64(embedding)));
        assertEquals(0, EmbeddingUtil.fromBase64(EmbeddingUtil.toBase64(new float[0])).length);
    }

    @Test
    @DisplayName("cosine similarity of parallel, orthogonal and opposite vectors")
    void testCosine() {
        assertEquals(1.0, EmbeddingUtil.cosineSimilarity(new float[] {1, 2}, new float[] {2, 4}), 1e-9);
        assertEquals(0.0, EmbeddingUtil.cosineSimilarity(new float[] {1, 0}, new float[] {0, 3}), 1e-9);
        assertEquals(-1.0, EmbeddingUtil.cosineSimilarity(new float[] {1, 1}, new float[] {-1, -1}), 1e-9);
    }

    @Test
    @DisplayName("a zero vector has no direction and scores 0")
    void testZeroVector() {
        assertEquals(0.0, EmbeddingUtil.cosineSimilarity(new float[] {0, 0}, new float[] {1, 1}));
    }

    @Test
    @DisplayName("dimension mismatches throw unless the tolerant variant is used")
    void testMismatch() {
        float[] a = {1, 0, 0};
        float[] b = {1, 0};

        assertThrows(IllegalArgumentException.class, () -> EmbeddingUtil.cosineSimilarity(a, b));
        assertEquals(0.0, EmbeddingUtil.safeCosine(a, b));
        assertEquals(0.0, EmbeddingUtil.safeCosine(null, b));
        assertEquals(0.0, EmbeddingUtil.safeCosine(new float[0], new float[0]));
    }
}
