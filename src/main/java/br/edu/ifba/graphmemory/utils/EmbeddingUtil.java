package br.edu.ifba.graphmemory.utils;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;

/**
 * Vector helpers: storage encoding and similarity.
 */
public final class EmbeddingUtil {

    private EmbeddingUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Converts a float array to base64-encoded little-endian bytes for compact storage.
     *
     * @param embedding The float array
     * @return Base64-encoded string
     */
    @NotNull
    public static String toBase64(@NotNull float[] embedding) {
        ByteBuffer buffer = ByteBuffer.allocate(embedding.length * Float.BYTES);
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        for (float value : embedding) {
            buffer.putFloat(value);
        }
        return Base64.getEncoder().encodeToString(buffer.array());
    }

    /**
     * Converts a base64-encoded string back to a float array.
     *
     * @param base64 The base64-encoded string
     * @return Float array
     */
    @NotNull
    public static float[] fromBase64(@NotNull String base64) {
        byte[] bytes = Base64.getDecoder().decode(base64);
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        buffer.order(ByteOrder.LITTLE_ENDIAN);

        float[] embedding = new float[bytes.length / Float.BYTES];
        for (int i = 0; i < embedding.length; i++) {
            embedding[i] = buffer.getFloat();
        }
        return embedding;
    }

    /**
     * Computes cosine similarity between two embeddings.
     * Returns a value between -1 (opposite) and 1 (identical), and 0 when either vector has zero norm.
     *
     * @param a First embedding
     * @param b Second embedding
     * @return Cosine similarity score
     */
    public static double cosineSimilarity(@NotNull float[] a, @NotNull float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException(
                "Embeddings must have same dimensions: " + a.length + " vs " + b.length
            );
        }

        double dotProduct = 0.0;
        double normA = 0.0;
        double normB = 0.0;

        for (int i = 0; i < a.length; i++) {
            dotProduct += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }

        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        double cosine = dotProduct / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(-1.0, Math.min(1.0, cosine));
    }

    /**
     * Cosine similarity tolerant of missing or mismatched vectors, which score 0.
     */
    public static double safeCosine(@Nullable float[] a, @Nullable float[] b) {
        if (a == null || b == null || a.length == 0 || a.length != b.length) {
            return 0.0;
        }
        return cosineSimilarity(a, b);
    }
}
