package br.edu.ifba.graphmemory.support;

import br.edu.ifba.graphmemory.capability.Embedder;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embedder: every lowercased token is hashed into one of
 * {@link #DIMENSIONS} buckets and the vector is L2-normalized. Texts sharing words have a
 * positive cosine; texts without common words are orthogonal unless their tokens collide.
 */
public class HashingEmbedder implements Embedder {

    public static final int DIMENSIONS = 256;

    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicInteger failuresLeft = new AtomicInteger();

    @Override
    public CompletableFuture<List<float[]>> embedBatch(@NotNull List<String> texts) {
        calls.incrementAndGet();
        if (failuresLeft.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            return CompletableFuture.failedFuture(new IllegalStateException("embedding provider down"));
        }
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vector(text));
        }
        return CompletableFuture.completedFuture(vectors);
    }

    public static float[] vector(String text) {
        float[] vector = new float[DIMENSIONS];
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (!token.isEmpty()) {
                vector[Math.floorMod(token.hashCode(), DIMENSIONS)] += 1.0f;
            }
        }
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }

    /**
     * Makes the next {@code count} calls fail.
     */
    public HashingEmbedder failNext(int count) {
        failuresLeft.set(count);
        return this;
    }

    public int calls() {
        return calls.get();
    }
}
