package br.edu.ifba.graphmemory.capability;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for text-to-vector embedding.
 * Implementations should handle API calls to embedding providers (OpenAI, Sentence Transformers, etc.).
 */
@FunctionalInterface
public interface Embedder {

    /**
     * Generate embeddings for a batch of texts.
     *
     * @param texts List of texts to embed
     * @return CompletableFuture with list of embedding vectors (one per input text, same order)
     */
    CompletableFuture<List<float[]>> embedBatch(@NotNull List<String> texts);

    /**
     * Convenience method for embedding a single text.
     */
    default CompletableFuture<float[]> embed(@NotNull String text) {
        return embedBatch(List.of(text)).thenApply(embeddings -> embeddings.get(0));
    }
}
